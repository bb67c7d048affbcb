package com.chapterbus.pipeline;

/**
 * Raised inside an orchestrator run once its cancellation scope has been cancelled.
 */
public class ChapterCancelledException extends RuntimeException {

    private final int chapterNumber;

    public ChapterCancelledException(int chapterNumber, String reason) {
        super("chapter " + chapterNumber + " cancelled: " + reason);
        this.chapterNumber = chapterNumber;
    }

    public int getChapterNumber() {
        return chapterNumber;
    }
}
