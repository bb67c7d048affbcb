package com.chapterbus.pipeline;

public enum ChapterStatus {
    IN_PROGRESS,
    DONE,
    /** Finalized with blocking review findings still unresolved. */
    COMPLETED_WITH_WARNINGS,
    FAILED
}
