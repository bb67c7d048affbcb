package com.chapterbus.bus;

/**
 * Per-bus delivery policy for topics with several handlers.
 */
public enum DispatchMode {
    /** Handlers of a topic run one after another, in subscription order. */
    SEQUENTIAL,
    /** Handlers of a topic run concurrently; each still sees the topic's messages in order. */
    PARALLEL
}
