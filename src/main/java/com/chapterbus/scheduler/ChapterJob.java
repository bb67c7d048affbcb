package com.chapterbus.scheduler;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.List;

/**
 * One chapter to generate, optionally after the chapter it continues from.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ChapterJob(int chapter, Integer dependsOn) {

    public ChapterJob {
        if (chapter < 1) {
            throw new IllegalArgumentException("chapter numbers start at 1, got " + chapter);
        }
    }

    public static ChapterJob independent(int chapter) {
        return new ChapterJob(chapter, null);
    }

    public static ChapterJob after(int chapter, int dependsOn) {
        return new ChapterJob(chapter, dependsOn);
    }

    /** Chapter N depends on N-1 for every N after the first in {@code chapters}. */
    public static List<ChapterJob> continuityChain(List<Integer> chapters) {
        List<ChapterJob> jobs = new ArrayList<>();
        Integer previous = null;
        for (int chapter : chapters) {
            jobs.add(new ChapterJob(chapter, previous));
            previous = chapter;
        }
        return jobs;
    }
}
