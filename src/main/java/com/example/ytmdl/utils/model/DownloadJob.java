package com.example.ytmdl.utils.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
public class DownloadJob {
    private String id;
    private String url;
    private JobStatus status;
    private Progress progress;
    private JobMetadata metadata;
    private String error;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private int retryCount;

    // Копия для отдачи наружу, без общих ссылок на изменяемые части
    public DownloadJob(DownloadJob other) {
        this.id = other.id;
        this.url = other.url;
        this.status = other.status;
        this.progress = other.progress != null ? new Progress(other.progress) : null;
        this.metadata = other.metadata != null ? new JobMetadata(other.metadata) : null;
        this.error = other.error;
        this.createdAt = other.createdAt;
        this.startedAt = other.startedAt;
        this.completedAt = other.completedAt;
        this.retryCount = other.retryCount;
    }
}
