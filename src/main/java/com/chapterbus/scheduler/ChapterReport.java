package com.chapterbus.scheduler;

import com.chapterbus.pipeline.ChapterRunResult;
import com.chapterbus.pipeline.ChapterStatus;
import com.chapterbus.pipeline.PipelineState;
import com.chapterbus.pipeline.ReviewFinding;
import com.chapterbus.stage.StageIssue;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Per-chapter line of a scheduler report. {@code lastState} is the state the chapter
 * was in when it stopped; null for skipped chapters.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChapterReport(
    int chapter,
    ChapterOutcome outcome,
    PipelineState lastState,
    String reason,
    int revisionRounds,
    List<StageIssue> issues,
    List<ReviewFinding> unresolvedFindings
) {

    public ChapterReport {
        issues = issues == null ? List.of() : List.copyOf(issues);
        unresolvedFindings = unresolvedFindings == null ? List.of() : List.copyOf(unresolvedFindings);
    }

    static ChapterReport from(ChapterRunResult result) {
        ChapterOutcome outcome;
        if (result.state() != PipelineState.DONE) {
            outcome = ChapterOutcome.FAILED;
        } else if (result.status() == ChapterStatus.COMPLETED_WITH_WARNINGS) {
            outcome = ChapterOutcome.COMPLETED_WITH_WARNINGS;
        } else {
            outcome = ChapterOutcome.DONE;
        }
        PipelineState lastState = result.failedAt() != null ? result.failedAt() : result.state();
        return new ChapterReport(result.chapterNumber(), outcome, lastState, result.reason(),
            result.revisionRounds(), result.issues(), result.unresolvedFindings());
    }

    static ChapterReport skipped(int chapter, String reason) {
        return new ChapterReport(chapter, ChapterOutcome.SKIPPED, null, reason, 0, List.of(), List.of());
    }

    static ChapterReport failed(int chapter, String reason) {
        return new ChapterReport(chapter, ChapterOutcome.FAILED, null, reason, 0, List.of(), List.of());
    }
}
