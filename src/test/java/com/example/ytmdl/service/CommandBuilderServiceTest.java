package com.example.ytmdl.service;

import com.example.ytmdl.config.ApplicationConfig;
import com.example.ytmdl.utils.model.CoverFormat;
import com.example.ytmdl.utils.model.DownloadMode;
import com.example.ytmdl.utils.model.DownloaderSettings;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandBuilderServiceTest {
    private static final String URL = "https://music.youtube.com/watch?v=aaaaaaaaaaa";

    private final CommandBuilderService builder = new CommandBuilderService();
    private final DownloaderSettings defaults = new ApplicationConfig().snapshot();

    @Test
    void defaultSettings() {
        assertEquals(List.of(
                "--output-path", "./downloads",
                "--temp-path", "./temp",
                "--itag", "141",
                "--cover-size", "1400",
                "--cover-format", "jpg",
                "--cover-quality", "95",
                "--template-folder", "{album_artist}/{album}",
                "--template-file", "{track:02d} {title}",
                "--template-date", "%Y-%m-%d",
                "--progress", "--verbose", URL), builder.buildArguments(defaults, URL));
    }

    @Test
    void everyOptionalFlag() {
        DownloaderSettings settings = defaults.toBuilder()
                .cookiesPath("/home/me/cookies.txt")
                .downloadMode(DownloadMode.AUDIO_VIDEO)
                .saveCover(false)
                .poToken("token")
                .excludeTags("lyrics,comment")
                .truncate(40)
                .overwrite(true)
                .noSyncedLyrics(true)
                .build();

        assertEquals(List.of(
                "--output-path", "./downloads",
                "--temp-path", "./temp",
                "--cookies-path", "/home/me/cookies.txt",
                "--itag", "141",
                "--audio-video",
                "--no-cover",
                "--template-folder", "{album_artist}/{album}",
                "--template-file", "{track:02d} {title}",
                "--template-date", "%Y-%m-%d",
                "--po-token", "token",
                "--exclude-tags", "lyrics,comment",
                "--truncate", "40",
                "--overwrite",
                "--no-synced-lyrics",
                "--progress", "--verbose", URL), builder.buildArguments(settings, URL));
    }

    @Test
    void blankOptionalValuesAreOmitted() {
        DownloaderSettings settings = defaults.toBuilder()
                .cookiesPath("  ")
                .poToken("")
                .downloadMode(DownloadMode.VIDEO)
                .coverFormat(CoverFormat.PNG)
                .build();

        List<String> args = builder.buildArguments(settings, URL);
        assertFalse(args.contains("--cookies-path"));
        assertFalse(args.contains("--po-token"));
        assertTrue(args.contains("--video"));
        assertEquals("png", args.get(args.indexOf("--cover-format") + 1));
    }

    @Test
    void commandStartsWithBinaryAndHidesToken() {
        DownloaderSettings settings = defaults.toBuilder().poToken("secret").build();

        List<String> command = builder.buildCommand("/usr/bin/gytmdl", settings, URL);

        assertEquals("/usr/bin/gytmdl", command.get(0));
        assertTrue(command.contains("secret"));
        assertFalse(builder.describe(command).contains("secret"));
        assertTrue(builder.describe(command).contains("--po-token ***"));
    }
}
