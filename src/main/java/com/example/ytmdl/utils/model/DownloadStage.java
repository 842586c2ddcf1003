package com.example.ytmdl.utils.model;

public enum DownloadStage {
    INITIALIZING,
    FETCHING_METADATA,
    DOWNLOADING_AUDIO,
    REMUXING,
    APPLYING_TAGS,
    FINALIZING,
    COMPLETED,
    FAILED
}
