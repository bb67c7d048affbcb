package com.chapterbus.scheduler;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SchedulerReport(List<ChapterReport> chapters, Instant startedAt, Instant finishedAt) {

    public SchedulerReport {
        chapters = List.copyOf(chapters);
    }

    public Optional<ChapterReport> report(int chapter) {
        return chapters.stream().filter(report -> report.chapter() == chapter).findFirst();
    }

    public ChapterOutcome outcome(int chapter) {
        return report(chapter)
            .map(ChapterReport::outcome)
            .orElseThrow(() -> new IllegalArgumentException("chapter " + chapter + " was not part of this run"));
    }

    public long count(ChapterOutcome outcome) {
        return chapters.stream().filter(report -> report.outcome() == outcome).count();
    }
}
