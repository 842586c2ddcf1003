package com.example.ytmdl.service;

import com.example.ytmdl.utils.model.DownloaderSettings;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class CommandBuilderService {

    public List<String> buildArguments(DownloaderSettings settings, String url) {
        List<String> command = new ArrayList<>();

        command.add("--output-path");
        command.add(settings.getOutputPath());
        command.add("--temp-path");
        command.add(settings.getTempPath());

        if (hasText(settings.getCookiesPath())) {
            command.add("--cookies-path");
            command.add(settings.getCookiesPath());
        }

        command.add("--itag");
        command.add(settings.getItag());

        switch (settings.getDownloadMode()) {
            case VIDEO -> command.add("--video");
            case AUDIO_VIDEO -> command.add("--audio-video");
            default -> {
                // AUDIO - режим по умолчанию, флаг не нужен
            }
        }

        if (settings.isSaveCover()) {
            command.addAll(List.of(
                    "--cover-size", String.valueOf(settings.getCoverSize()),
                    "--cover-format", settings.getCoverFormat().argument(),
                    "--cover-quality", String.valueOf(settings.getCoverQuality())));
        } else {
            command.add("--no-cover");
        }

        command.addAll(List.of(
                "--template-folder", settings.getTemplateFolder(),
                "--template-file", settings.getTemplateFile(),
                "--template-date", settings.getTemplateDate()));

        if (hasText(settings.getPoToken())) {
            command.add("--po-token");
            command.add(settings.getPoToken());
        }
        if (hasText(settings.getExcludeTags())) {
            command.add("--exclude-tags");
            command.add(settings.getExcludeTags());
        }
        if (settings.getTruncate() != null) {
            command.add("--truncate");
            command.add(String.valueOf(settings.getTruncate()));
        }
        if (settings.isOverwrite()) {
            command.add("--overwrite");
        }
        if (settings.isNoSyncedLyrics()) {
            command.add("--no-synced-lyrics");
        }

        command.add("--progress");
        command.add("--verbose");
        command.add(url);
        return command;
    }

    public List<String> buildCommand(String binaryPath, DownloaderSettings settings, String url) {
        List<String> command = new ArrayList<>();
        command.add(binaryPath);
        command.addAll(buildArguments(settings, url));
        return command;
    }

    // Токен не должен попадать в логи
    public String describe(List<String> command) {
        List<String> masked = new ArrayList<>(command);
        for (int i = 0; i < masked.size() - 1; i++) {
            if ("--po-token".equals(masked.get(i))) {
                masked.set(i + 1, "***");
            }
        }
        return String.join(" ", masked);
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
