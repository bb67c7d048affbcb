package com.chapterbus.stage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation flag for one chapter run plus the requests it has in flight.
 *
 * Cancelling the scope cancels every registered future; futures registered after
 * cancellation are cancelled immediately.
 */
public class CancellationScope {

    private static final Logger log = LoggerFactory.getLogger(CancellationScope.class);

    private final AtomicReference<String> reason = new AtomicReference<>();
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();

    public <F extends Future<?>> F register(F future) {
        inFlight.add(future);
        if (isCancelled()) {
            future.cancel(true);
        }
        return future;
    }

    public void release(Future<?> future) {
        inFlight.remove(future);
    }

    /** Returns false when the scope was already cancelled. */
    public boolean cancel(String why) {
        if (!reason.compareAndSet(null, why == null ? "cancelled" : why)) {
            return false;
        }
        log.info("Cancelling {} in-flight request(s): {}", inFlight.size(), reason.get());
        for (Future<?> future : inFlight) {
            future.cancel(true);
        }
        inFlight.clear();
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }

    public int inFlightCount() {
        return inFlight.size();
    }
}
