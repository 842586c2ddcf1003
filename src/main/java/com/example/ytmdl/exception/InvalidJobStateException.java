package com.example.ytmdl.exception;

import com.example.ytmdl.utils.model.JobStatus;
import lombok.Getter;

@Getter
public class InvalidJobStateException extends QueueException {
    private final String jobId;
    private final JobStatus status;

    public InvalidJobStateException(String jobId, JobStatus status, String operation) {
        super("Cannot " + operation + " job " + jobId + " in status " + status);
        this.jobId = jobId;
        this.status = status;
    }

    @Override
    public String getErrorCode() {
        return "INVALID_STATE";
    }
}
