package com.chapterbus.bus;

import com.chapterbus.contract.Message;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * An issued request waiting for its correlated reply. Lives from {@link EventBus#request}
 * until the first reply, the deadline, or cancellation, whichever happens first.
 */
final class PendingRequest {

    private final String correlationId;
    private final String topic;
    private final Instant deadline;
    private final CompletableFuture<Message> outcome = new CompletableFuture<>();
    private volatile ScheduledFuture<?> timeoutTask;

    PendingRequest(String correlationId, String topic, Instant deadline) {
        this.correlationId = correlationId;
        this.topic = topic;
        this.deadline = deadline;
    }

    String correlationId() {
        return correlationId;
    }

    String topic() {
        return topic;
    }

    Instant deadline() {
        return deadline;
    }

    CompletableFuture<Message> outcome() {
        return outcome;
    }

    void armTimeout(ScheduledFuture<?> task) {
        this.timeoutTask = task;
    }

    void disarmTimeout() {
        ScheduledFuture<?> task = timeoutTask;
        if (task != null) {
            task.cancel(false);
        }
    }
}
