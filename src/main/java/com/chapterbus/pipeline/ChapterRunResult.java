package com.chapterbus.pipeline;

import com.chapterbus.stage.StageIssue;
import com.chapterbus.stage.StageResult;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Outcome of one orchestrator run.
 *
 * A run that failed while finalizing keeps its snapshot so the caller can retry the
 * commit with identical content.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChapterRunResult(
    int chapterNumber,
    PipelineState state,
    PipelineState failedAt,
    ChapterStatus status,
    String reason,
    int revisionRounds,
    List<StageIssue> issues,
    List<ReviewFinding> unresolvedFindings,
    List<StageTiming> timings,
    @JsonIgnore List<StageResult> stageResults,
    @JsonIgnore ChapterSnapshot snapshot
) {

    public ChapterRunResult {
        issues = List.copyOf(issues);
        unresolvedFindings = List.copyOf(unresolvedFindings);
        timings = List.copyOf(timings);
        stageResults = List.copyOf(stageResults);
    }

    static ChapterRunResult from(ChapterState state, ChapterSnapshot snapshot) {
        return new ChapterRunResult(
            state.chapterNumber(),
            state.state(),
            state.failedAt(),
            state.status(),
            state.reason(),
            state.revisionRound(),
            state.issues(),
            state.unresolvedFindings(),
            state.timings(),
            state.stageResults(),
            snapshot);
    }

    @JsonIgnore
    public boolean isDone() {
        return state == PipelineState.DONE;
    }

    @JsonIgnore
    public boolean isRetryableFinalize() {
        return state == PipelineState.FAILED && failedAt == PipelineState.FINALIZING && snapshot != null;
    }

    public StageResult stageResult(String stageName) {
        return stageResults.stream()
            .filter(result -> result.stageName().equals(stageName))
            .reduce((first, second) -> second)
            .orElse(null);
    }
}
