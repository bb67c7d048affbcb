package com.chapterbus.stage;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * One request to one worker inside a stage.
 *
 * The payload builder receives the previous call's output in a SEQUENTIAL stage and
 * an empty map otherwise.
 */
public record WorkerCall(
    String key,
    String worker,
    Function<Map<String, Object>, Map<String, Object>> payloadBuilder,
    Duration timeout
) {

    public WorkerCall {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("call key is required");
        }
        if (worker == null || worker.isBlank()) {
            throw new IllegalArgumentException("worker is required for call " + key);
        }
        Objects.requireNonNull(payloadBuilder, "payloadBuilder");
        Objects.requireNonNull(timeout, "timeout");
    }

    public static WorkerCall of(String key, String worker, Map<String, Object> payload, Duration timeout) {
        Map<String, Object> fixed = Map.copyOf(payload);
        return new WorkerCall(key, worker, previous -> fixed, timeout);
    }

    public static WorkerCall chained(String key, String worker,
                                     Function<Map<String, Object>, Map<String, Object>> payloadBuilder,
                                     Duration timeout) {
        return new WorkerCall(key, worker, payloadBuilder, timeout);
    }
}
