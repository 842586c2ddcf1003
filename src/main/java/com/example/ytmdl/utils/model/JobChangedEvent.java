package com.example.ytmdl.utils.model;

import lombok.Value;

/**
 * Published after a job changed. {@code job} is a copy taken at the moment of the change.
 */
@Value
public class JobChangedEvent {
    public enum Change {
        ADDED,
        STARTED,
        PROGRESS,
        CANCEL_REQUESTED,
        COMPLETED,
        FAILED,
        CANCELLED,
        REQUEUED,
        REMOVED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED || this == CANCELLED;
        }
    }

    Change change;
    DownloadJob job;
}
