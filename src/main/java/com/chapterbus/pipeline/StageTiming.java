package com.chapterbus.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Duration;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StageTiming(String stage, String outcome, Instant startedAt, Instant completedAt) {

    @JsonProperty("duration_ms")
    public long durationMillis() {
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
