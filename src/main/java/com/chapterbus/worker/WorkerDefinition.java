package com.chapterbus.worker;

import java.time.Duration;
import java.util.Objects;

/**
 * One entry of the worker dispatch table: who serves a worker name, under which
 * rate-limit provider, with which fallback deadline.
 */
public record WorkerDefinition(
    String name,
    String providerId,
    Duration defaultTimeout,
    WorkerCollaborator collaborator
) {

    public WorkerDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("worker name is required");
        }
        Objects.requireNonNull(collaborator, "collaborator is required for worker " + name);
        providerId = providerId == null || providerId.isBlank() ? name : providerId;
        defaultTimeout = defaultTimeout == null ? Duration.ofSeconds(60) : defaultTimeout;
    }
}
