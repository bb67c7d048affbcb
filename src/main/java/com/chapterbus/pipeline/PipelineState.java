package com.chapterbus.pipeline;

/**
 * Per-chapter orchestrator states, in transition order. FAILED is reachable from
 * every non-terminal state.
 */
public enum PipelineState {
    PLANNING,
    WORLD_AND_CHARACTERS,
    COMPOSING,
    ASSEMBLING,
    REVIEWING,
    FINALIZING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
