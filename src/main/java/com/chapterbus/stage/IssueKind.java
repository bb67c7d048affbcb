package com.chapterbus.stage;

public enum IssueKind {
    TIMEOUT,
    WORKER_FAILURE,
    CANCELLED
}
