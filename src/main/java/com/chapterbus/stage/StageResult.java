package com.chapterbus.stage;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merged outcome of a stage. Outputs are keyed and sorted by call key and issues are
 * sorted by call key, so the result never depends on completion order.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StageResult(
    String stageName,
    StageStatus status,
    Map<String, Map<String, Object>> outputs,
    List<StageIssue> issues
) {

    public StageResult {
        outputs = Collections.unmodifiableSortedMap(new TreeMap<>(outputs));
        issues = issues.stream()
            .sorted(Comparator.comparing(StageIssue::callKey))
            .toList();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == StageStatus.SUCCESS;
    }

    @JsonIgnore
    public boolean isFailure() {
        return status == StageStatus.FAILURE;
    }

    public Map<String, Object> output(String callKey) {
        return outputs.get(callKey);
    }

    public boolean hasIssue(IssueKind kind) {
        return issues.stream().anyMatch(issue -> issue.kind() == kind);
    }
}
