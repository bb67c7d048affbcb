package com.chapterbus.worker;

import com.chapterbus.contract.FailureKind;

/**
 * Failure reported by a worker collaborator. Worker adapters turn it into an
 * error-tagged reply; it never crosses the bus as an exception.
 */
public class WorkerException extends RuntimeException {

    private final FailureKind kind;

    public WorkerException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public WorkerException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
