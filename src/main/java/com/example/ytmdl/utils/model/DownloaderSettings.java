package com.example.ytmdl.utils.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Read-only copy of the downloader configuration, taken once per dispatch.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DownloaderSettings {
    String outputPath;
    String tempPath;
    String cookiesPath;
    String itag;
    DownloadMode downloadMode;
    boolean saveCover;
    int coverSize;
    CoverFormat coverFormat;
    int coverQuality;
    String templateFolder;
    String templateFile;
    String templateDate;
    String poToken;
    String excludeTags;
    Integer truncate;
    boolean overwrite;
    boolean noSyncedLyrics;
}
