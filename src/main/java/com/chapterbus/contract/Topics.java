package com.chapterbus.contract;

/**
 * Well-known topic names.
 *
 * Worker request topics are derived from the worker name so the registry can be
 * built from configuration alone.
 */
public final class Topics {

    /** Bus-internal inbox that every request/response reply is published to. */
    public static final String REPLY_INBOX = "bus.reply";

    /** Cancellation notices for in-flight requests; payload carries correlation_id. */
    public static final String CANCEL = "bus.cancel";

    public static final String STAGE_STARTED = "pipeline.stage.started";
    public static final String STAGE_COMPLETED = "pipeline.stage.completed";
    public static final String CHAPTER_FAILED = "pipeline.chapter.failed";
    public static final String CHAPTER_FINALIZED = "pipeline.chapter.finalized";

    private static final String WORKER_PREFIX = "worker.";
    private static final String REQUEST_SUFFIX = ".request";

    private Topics() {
    }

    public static String workerRequest(String workerName) {
        if (workerName == null || workerName.isBlank()) {
            throw new IllegalArgumentException("worker name is required");
        }
        return WORKER_PREFIX + workerName + REQUEST_SUFFIX;
    }

    public static boolean isInternal(String topic) {
        return REPLY_INBOX.equals(topic) || CANCEL.equals(topic);
    }
}
