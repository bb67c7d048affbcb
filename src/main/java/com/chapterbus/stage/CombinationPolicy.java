package com.chapterbus.stage;

/**
 * How a stage runs its worker calls.
 */
public enum CombinationPolicy {
    /** One call at a time; each call sees the previous call's output. */
    SEQUENTIAL,
    /** All calls issued together; results merged once every call has settled. */
    PARALLEL
}
