package com.chapterbus.scheduler;

public enum ChapterOutcome {
    DONE,
    COMPLETED_WITH_WARNINGS,
    FAILED,
    /** Not attempted because its dependency did not complete. */
    SKIPPED;

    public boolean isCompleted() {
        return this == DONE || this == COMPLETED_WITH_WARNINGS;
    }
}
