package com.example.ytmdl.config;

import com.example.ytmdl.exception.ValidationException;
import com.example.ytmdl.utils.model.CoverFormat;
import com.example.ytmdl.utils.model.DownloadMode;
import com.example.ytmdl.utils.model.DownloaderSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationConfigTest {
    @TempDir
    Path tempDir;

    @Test
    void missingFileIsCreatedWithDefaults() {
        ApplicationConfig config = configAt(tempDir.resolve("queue.cfg"));

        config.loadConfig();

        assertTrue(Files.exists(tempDir.resolve("queue.cfg")));
        assertEquals("141", config.getItag());
        assertEquals(3, config.getConcurrentLimit());
    }

    @Test
    void savedSettingsAreLoadedBack() {
        Path file = tempDir.resolve("queue.cfg");
        ApplicationConfig config = configAt(file);
        config.updateSettings(config.snapshot().toBuilder()
                .outputPath("/music")
                .downloadMode(DownloadMode.VIDEO)
                .coverFormat(CoverFormat.WEBP)
                .poToken("token")
                .truncate(30)
                .build());
        config.setConcurrentLimit(5);
        config.saveConfig();

        ApplicationConfig loaded = configAt(file);
        loaded.loadConfig();

        DownloaderSettings settings = loaded.snapshot();
        assertEquals("/music", settings.getOutputPath());
        assertEquals(DownloadMode.VIDEO, settings.getDownloadMode());
        assertEquals(CoverFormat.WEBP, settings.getCoverFormat());
        assertEquals("token", settings.getPoToken());
        assertEquals(30, settings.getTruncate());
        assertNull(settings.getCookiesPath());
        assertEquals(5, loaded.getConcurrentLimit());
    }

    @Test
    void invalidSettingsAreRejectedAsAWhole() {
        ApplicationConfig config = configAt(tempDir.resolve("queue.cfg"));
        DownloaderSettings before = config.snapshot();

        assertThrows(ValidationException.class, () -> config.updateSettings(before.toBuilder()
                .outputPath("/elsewhere")
                .coverQuality(0)
                .build()));
        assertThrows(ValidationException.class, () -> config.updateSettings(before.toBuilder()
                .outputPath(" ")
                .build()));

        assertEquals(before, config.snapshot());
        assertFalse(Files.exists(tempDir.resolve("queue.cfg")));
    }

    @Test
    void unreadableValuesKeepDefaults() throws Exception {
        Path file = tempDir.resolve("queue.cfg");
        Files.writeString(file, "outputPath=/music\ncoverSize=\ndownloadMode=LOUD\n");
        ApplicationConfig config = configAt(file);

        config.loadConfig();

        assertEquals("./downloads", config.getOutputPath());
        assertEquals(1400, config.getCoverSize());
        assertEquals(DownloadMode.AUDIO, config.getDownloadMode());
    }

    @Test
    void outOfRangeValuesKeepDefaults() throws Exception {
        Path file = tempDir.resolve("queue.cfg");
        Files.writeString(file, "outputPath=/music\ncoverQuality=500\n");
        ApplicationConfig config = configAt(file);

        config.loadConfig();

        assertEquals(95, config.getCoverQuality());
        assertEquals("./downloads", config.getOutputPath());

        Files.writeString(file, "concurrentLimit=0\n");
        config.loadConfig();
        assertEquals(3, config.getConcurrentLimit());
    }

    @Test
    void snapshotIsNotAffectedByLaterChanges() {
        ApplicationConfig config = configAt(tempDir.resolve("queue.cfg"));
        config.setPersistSettings(false);
        DownloaderSettings snapshot = config.snapshot();

        config.updateSettings(snapshot.toBuilder().itag("251").build());

        assertEquals("141", snapshot.getItag());
        assertEquals("251", config.snapshot().getItag());
    }

    private static ApplicationConfig configAt(Path file) {
        ApplicationConfig config = new ApplicationConfig();
        config.setConfigFile(file.toString());
        return config;
    }
}
