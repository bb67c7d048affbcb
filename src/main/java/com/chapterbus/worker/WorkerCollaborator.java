package com.chapterbus.worker;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * An external content-generation worker, opaque to the pipeline.
 *
 * Implementations complete the returned future with the result payload, or
 * exceptionally with a {@link WorkerException}. Cancelling the future asks the
 * worker to stop; honoring that is best effort.
 */
@FunctionalInterface
public interface WorkerCollaborator {

    CompletableFuture<Map<String, Object>> invoke(Map<String, Object> payload, Instant deadline);
}
