package com.example.ytmdl.utils.model;

import lombok.Value;

/**
 * Message from a runner to the queue. Exactly one of {@code progress} and {@code result} is set;
 * a result is always the last message of a run.
 */
@Value
public class RunnerEvent {
    String jobId;
    long runId;
    Progress progress;
    RunnerResult result;

    public static RunnerEvent progress(String jobId, long runId, Progress progress) {
        return new RunnerEvent(jobId, runId, progress, null);
    }

    public static RunnerEvent finished(String jobId, long runId, RunnerResult result) {
        return new RunnerEvent(jobId, runId, null, result);
    }

    public boolean isTerminal() {
        return result != null;
    }
}
