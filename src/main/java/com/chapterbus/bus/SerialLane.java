package com.chapterbus.bus;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs submitted tasks one at a time, in submission order, on a shared executor.
 * At most one drain task per lane is scheduled at any moment.
 */
final class SerialLane {

    private static final int BATCH_LIMIT = 64;

    private final Executor executor;
    private final Queue<Runnable> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean(false);

    SerialLane(Executor executor) {
        this.executor = executor;
    }

    void submit(Runnable task) {
        queue.add(task);
        schedule();
    }

    private void schedule() {
        if (scheduled.compareAndSet(false, true)) {
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException ex) {
                scheduled.set(false);
                throw ex;
            }
        }
    }

    private void drain() {
        try {
            int processed = 0;
            Runnable task;
            // yield the thread after a batch so one busy lane cannot starve the others
            while (processed < BATCH_LIMIT && (task = queue.poll()) != null) {
                task.run();
                processed++;
            }
        } finally {
            scheduled.set(false);
            if (!queue.isEmpty()) {
                schedule();
            }
        }
    }
}
