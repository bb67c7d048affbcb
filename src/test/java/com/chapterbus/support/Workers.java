package com.chapterbus.support;

import com.chapterbus.contract.FailureKind;
import com.chapterbus.worker.WorkerCollaborator;
import com.chapterbus.worker.WorkerException;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * In-process collaborators for tests.
 */
public final class Workers {

    private Workers() {
    }

    /** Answers every call with {@code reply(payload)}. */
    public static WorkerCollaborator answering(Function<Map<String, Object>, Map<String, Object>> reply) {
        return (payload, deadline) -> CompletableFuture.completedFuture(reply.apply(payload));
    }

    public static WorkerCollaborator constant(Map<String, Object> reply) {
        return answering(payload -> reply);
    }

    public static WorkerCollaborator failing(FailureKind kind, String message) {
        return (payload, deadline) -> CompletableFuture.failedFuture(new WorkerException(kind, message));
    }

    /** Replies after {@code delay}, without blocking the adapter's pool. */
    public static WorkerCollaborator delayed(Duration delay, Map<String, Object> reply) {
        Executor later = CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS);
        return (payload, deadline) -> CompletableFuture.supplyAsync(() -> reply, later);
    }

    /** Never completes unless cancelled. */
    public static WorkerCollaborator hanging() {
        return (payload, deadline) -> new CompletableFuture<>();
    }
}
