package com.example.ytmdl.service;

import com.example.ytmdl.utils.constants.RegexPatterns;
import com.example.ytmdl.utils.model.DownloadStage;
import com.example.ytmdl.utils.model.JobMetadata;
import com.example.ytmdl.utils.model.Progress;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Turns downloader output lines into progress observations. Lines it does not recognise yield
 * nothing.
 */
@Service
public class ProgressParsingService {

    public String sanitize(String line) {
        if (line == null) {
            return "";
        }
        return RegexPatterns.ANSI_PATTERN.matcher(line).replaceAll("").trim();
    }

    public Optional<Progress> parse(String rawLine) {
        String line = sanitize(rawLine);
        if (line.isEmpty()) {
            return Optional.empty();
        }

        Optional<Progress> progress = parseDownloadProgress(line);
        if (progress.isEmpty()) {
            progress = parseStepProgress(line);
        }
        if (progress.isEmpty()) {
            progress = parseStageIndicator(line);
        }
        if (progress.isEmpty()) {
            progress = parseStageKeyword(line);
        }
        return progress;
    }

    public boolean isErrorLine(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        return lower.contains("error")
                || lower.contains("failed")
                || lower.contains("exception")
                || lower.contains("traceback")
                || lower.startsWith("fatal:");
    }

    public boolean isCompletionLine(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        return lower.contains("download completed")
                || lower.contains("successfully downloaded")
                || lower.contains("finished downloading")
                || (lower.contains("100%") && lower.contains("download"));
    }

    /**
     * Records {@code [gytmdl] Title: ...} style lines into {@code metadata}.
     *
     * @return true if the line carried metadata
     */
    public boolean collectMetadata(String line, JobMetadata metadata) {
        Matcher matcher = RegexPatterns.METADATA_PATTERN.matcher(line);
        if (!matcher.find()) {
            return false;
        }
        String value = matcher.group(2).trim();
        switch (matcher.group(1)) {
            case "Title" -> metadata.setTitle(value);
            case "Artist" -> metadata.setArtist(value);
            case "Album" -> metadata.setAlbum(value);
            default -> {
                return false;
            }
        }
        return true;
    }

    private Optional<Progress> parseDownloadProgress(String line) {
        Matcher matcher = RegexPatterns.PROGRESS_PATTERN.matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }
        float percentage = Math.min(100f, Float.parseFloat(matcher.group(1)));
        return Optional.of(new Progress(DownloadStage.DOWNLOADING_AUDIO, percentage, line, null, null));
    }

    private Optional<Progress> parseStepProgress(String line) {
        Matcher matcher = RegexPatterns.STEP_PATTERN.matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String current = matcher.group(1) != null ? matcher.group(1) : matcher.group(3);
        String total = matcher.group(2) != null ? matcher.group(2) : matcher.group(4);

        int index;
        int steps;
        try {
            index = Integer.parseInt(current);
            steps = Integer.parseInt(total);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }

        Float percentage = null;
        if (steps > 0) {
            float raw = (float) index / steps * 100f;
            percentage = Math.min(100f, Math.round(raw * 100f) / 100f);
        }
        return Optional.of(new Progress(inferStage(line), percentage, line, index, steps));
    }

    private Optional<Progress> parseStageIndicator(String line) {
        DownloadStage stage = null;
        if (line.contains("Initializing") || line.contains("Starting") || line.contains("Setting up")) {
            stage = DownloadStage.INITIALIZING;
        } else if ((line.contains("Fetching") && (line.contains("metadata") || line.contains("info")))
                || line.contains("Getting video info") || line.contains("Extracting")) {
            stage = DownloadStage.FETCHING_METADATA;
        } else if (line.contains("[download]") && !line.contains("%")) {
            stage = DownloadStage.DOWNLOADING_AUDIO;
        } else if (line.contains("Remuxing") || line.contains("Processing")
                || line.contains("Converting") || line.contains("Merging")) {
            stage = DownloadStage.REMUXING;
        } else if (line.contains("Applying tags") || line.contains("Writing tags")
                || line.contains("Adding metadata") || line.contains("Tagging")
                || line.contains("Writing metadata") || line.contains("Adding cover")) {
            stage = DownloadStage.APPLYING_TAGS;
        } else if (line.contains("Finalizing") || line.contains("Finishing")
                || line.contains("Completed") || line.contains("Done") || line.contains("completed")) {
            stage = DownloadStage.FINALIZING;
        }
        return Optional.ofNullable(stage).map(s -> Progress.of(s, line));
    }

    private Optional<Progress> parseStageKeyword(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        DownloadStage stage;
        if (lower.contains("init") || lower.contains("start")) {
            stage = DownloadStage.INITIALIZING;
        } else if (lower.contains("fetch") || lower.contains("extract")
                || lower.contains("metadata") || lower.contains("info")) {
            stage = DownloadStage.FETCHING_METADATA;
        } else if (lower.contains("download") || lower.contains("audio")) {
            stage = DownloadStage.DOWNLOADING_AUDIO;
        } else if (lower.contains("remux") || lower.contains("process") || lower.contains("convert")) {
            stage = DownloadStage.REMUXING;
        } else if (lower.contains("tag")) {
            stage = DownloadStage.APPLYING_TAGS;
        } else if (lower.contains("final") || lower.contains("complete")
                || lower.contains("done") || lower.contains("finish")) {
            stage = DownloadStage.FINALIZING;
        } else {
            return Optional.empty();
        }
        return Optional.of(Progress.of(stage, line));
    }

    private DownloadStage inferStage(String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        if (lower.contains("init") || lower.contains("start")) {
            return DownloadStage.INITIALIZING;
        } else if (lower.contains("fetch") || lower.contains("extract") || lower.contains("metadata")) {
            return DownloadStage.FETCHING_METADATA;
        } else if (lower.contains("download") || lower.contains("audio")) {
            return DownloadStage.DOWNLOADING_AUDIO;
        } else if (lower.contains("remux") || lower.contains("process") || lower.contains("convert")) {
            return DownloadStage.REMUXING;
        } else if (lower.contains("tag")) {
            return DownloadStage.APPLYING_TAGS;
        } else if (lower.contains("final") || lower.contains("complete")) {
            return DownloadStage.FINALIZING;
        }
        return DownloadStage.DOWNLOADING_AUDIO;
    }
}
