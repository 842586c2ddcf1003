package com.example.ytmdl.utils.model;

/**
 * Lifecycle of a queued download.
 *
 * QUEUED -> RUNNING -> {COMPLETED, FAILED, CANCELLED}
 * FAILED, CANCELLED -> QUEUED on explicit retry
 * QUEUED -> CANCELLED on cancel before dispatch
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isRetryable() {
        return this == FAILED || this == CANCELLED;
    }
}
