package com.example.ytmdl.utils.model;

import lombok.Value;

/**
 * How one run of the downloader ended.
 */
@Value
public class RunnerResult {
    public enum Kind {
        SUCCESS,
        SPAWN_ERROR,
        EXECUTION_ERROR,
        CANCELLED
    }

    Kind kind;
    String message;
    Integer exitCode;
    JobMetadata metadata;

    public static RunnerResult success(JobMetadata metadata) {
        return new RunnerResult(Kind.SUCCESS, null, 0, metadata);
    }

    public static RunnerResult spawnError(String message) {
        return new RunnerResult(Kind.SPAWN_ERROR, message, null, null);
    }

    public static RunnerResult executionError(String message, Integer exitCode) {
        return new RunnerResult(Kind.EXECUTION_ERROR, message, exitCode, null);
    }

    public static RunnerResult cancelled() {
        return new RunnerResult(Kind.CANCELLED, null, null, null);
    }
}
