package com.example.ytmdl.utils.model;

public enum DownloadMode {
    AUDIO,
    VIDEO,
    AUDIO_VIDEO
}
