package com.chapterbus.worker;

import java.time.Instant;

/**
 * Gates outbound worker calls per provider. Consumed only by {@link WorkerAdapter}.
 */
public interface RateLimiter {

    /**
     * Blocks until {@code providerId} may issue one more call.
     *
     * @throws WorkerException with DEADLINE_EXCEEDED when no permit can be granted before {@code deadline}
     */
    void acquire(String providerId, Instant deadline) throws InterruptedException;

    static RateLimiter unlimited() {
        return (providerId, deadline) -> { };
    }
}
