package com.chapterbus.stage;

import com.chapterbus.contract.FailureKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A worker call that did not produce an output. {@code failureKind} is set when the
 * worker answered with an error-tagged reply.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StageIssue(
    String stageName,
    String callKey,
    String worker,
    IssueKind kind,
    FailureKind failureKind,
    String description
) {
}
