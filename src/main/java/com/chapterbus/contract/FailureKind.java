package com.chapterbus.contract;

import java.util.Arrays;

/**
 * Why a worker call did not produce a result. Travels inside error-tagged replies.
 */
public enum FailureKind {
    PROVIDER_ERROR,
    RATE_LIMITED,
    INVALID_RESPONSE,
    DEADLINE_EXCEEDED,
    CANCELLED;

    public static FailureKind fromValue(String raw) {
        if (raw == null) {
            return PROVIDER_ERROR;
        }
        return Arrays.stream(values())
            .filter(v -> v.name().equalsIgnoreCase(raw))
            .findFirst()
            .orElse(PROVIDER_ERROR);
    }
}
