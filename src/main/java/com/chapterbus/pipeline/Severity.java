package com.chapterbus.pipeline;

import java.util.Locale;

public enum Severity {
    ADVISORY,
    BLOCKING,
    /** Blocking, and fails the chapter if still present once the revision budget is spent. */
    FATAL;

    public boolean isBlocking() {
        return this != ADVISORY;
    }

    /** Unknown or missing severities are advisory. */
    public static Severity fromValue(Object raw) {
        if (raw == null) {
            return ADVISORY;
        }
        try {
            return valueOf(String.valueOf(raw).trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return ADVISORY;
        }
    }
}
