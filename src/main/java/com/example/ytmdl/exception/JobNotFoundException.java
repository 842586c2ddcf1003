package com.example.ytmdl.exception;

import lombok.Getter;

@Getter
public class JobNotFoundException extends QueueException {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    @Override
    public String getErrorCode() {
        return "NOT_FOUND";
    }
}
