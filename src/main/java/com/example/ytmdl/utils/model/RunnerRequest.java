package com.example.ytmdl.utils.model;

import lombok.Value;

@Value
public class RunnerRequest {
    String jobId;
    long runId;
    String url;
    DownloaderSettings settings;
}
