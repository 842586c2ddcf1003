package com.example.ytmdl.service;

import com.example.ytmdl.exception.InvalidJobStateException;
import com.example.ytmdl.utils.model.DownloadJob;
import com.example.ytmdl.utils.model.JobMetadata;
import com.example.ytmdl.utils.model.JobStatus;
import com.example.ytmdl.utils.model.Progress;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Legal status transitions of a single job. Every method either applies its transition or throws
 * {@link InvalidJobStateException} without touching the job. Callers serialize access.
 */
@Component
public class JobStateMachine {

    public DownloadJob create(String id, String url, LocalDateTime now) {
        DownloadJob job = new DownloadJob();
        job.setId(id);
        job.setUrl(url);
        job.setStatus(JobStatus.QUEUED);
        job.setProgress(Progress.waiting());
        job.setCreatedAt(now);
        return job;
    }

    public void dispatch(DownloadJob job, LocalDateTime now) {
        require(job, JobStatus.QUEUED, "dispatch");
        job.setStatus(JobStatus.RUNNING);
        job.setStartedAt(now);
        job.setProgress(Progress.initializing());
    }

    public void updateProgress(DownloadJob job, Progress progress) {
        require(job, JobStatus.RUNNING, "update progress of");
        job.setProgress(new Progress(progress));
    }

    public void complete(DownloadJob job, JobMetadata metadata, LocalDateTime now) {
        require(job, JobStatus.RUNNING, "complete");
        job.setStatus(JobStatus.COMPLETED);
        job.setProgress(Progress.completed());
        if (metadata != null) {
            job.setMetadata(new JobMetadata(metadata));
        }
        job.setCompletedAt(now);
    }

    public void fail(DownloadJob job, String error, LocalDateTime now) {
        require(job, JobStatus.RUNNING, "fail");
        String cause = error == null || error.isBlank() ? "Unknown error" : error;
        job.setStatus(JobStatus.FAILED);
        job.setError(cause);
        job.setProgress(Progress.failed(cause));
        job.setCompletedAt(now);
    }

    // Отмена до запуска: раннер не участвует
    public void cancelQueued(DownloadJob job, LocalDateTime now) {
        require(job, JobStatus.QUEUED, "cancel");
        job.setStatus(JobStatus.CANCELLED);
        job.setCompletedAt(now);
    }

    public void acknowledgeCancel(DownloadJob job, LocalDateTime now) {
        require(job, JobStatus.RUNNING, "acknowledge cancellation of");
        job.setStatus(JobStatus.CANCELLED);
        job.setError(null);
        job.setCompletedAt(now);
    }

    public void retry(DownloadJob job) {
        if (!job.getStatus().isRetryable()) {
            throw new InvalidJobStateException(job.getId(), job.getStatus(), "retry");
        }
        job.setStatus(JobStatus.QUEUED);
        job.setProgress(Progress.waiting());
        job.setError(null);
        job.setStartedAt(null);
        job.setCompletedAt(null);
        job.setRetryCount(job.getRetryCount() + 1);
    }

    public void checkRemovable(DownloadJob job) {
        if (job.getStatus() == JobStatus.RUNNING) {
            throw new InvalidJobStateException(job.getId(), job.getStatus(), "remove");
        }
    }

    private static void require(DownloadJob job, JobStatus expected, String operation) {
        if (job.getStatus() != expected) {
            throw new InvalidJobStateException(job.getId(), job.getStatus(), operation);
        }
    }
}
