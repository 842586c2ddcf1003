package com.example.ytmdl.config;

import com.example.ytmdl.exception.ValidationException;
import com.example.ytmdl.utils.model.CoverFormat;
import com.example.ytmdl.utils.model.DownloadMode;
import com.example.ytmdl.utils.model.DownloaderSettings;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "app.download")
public class ApplicationConfig {
    private String outputPath = "./downloads";
    private String tempPath = "./temp";
    private String cookiesPath;
    private String itag = "141";
    private DownloadMode downloadMode = DownloadMode.AUDIO;
    private boolean saveCover = true;
    private int coverSize = 1400;
    private CoverFormat coverFormat = CoverFormat.JPG;
    private int coverQuality = 95;
    private String templateFolder = "{album_artist}/{album}";
    private String templateFile = "{track:02d} {title}";
    private String templateDate = "%Y-%m-%d";
    private String poToken;
    private String excludeTags;
    private Integer truncate;
    private boolean overwrite = false;
    private boolean noSyncedLyrics = false;

    // Читается планировщиком при каждом решении о запуске
    private volatile int concurrentLimit = 3;

    private boolean persistSettings = true;
    private String configFile = "gytmdl-queue.cfg";

    public synchronized DownloaderSettings snapshot() {
        return DownloaderSettings.builder()
                .outputPath(outputPath)
                .tempPath(tempPath)
                .cookiesPath(cookiesPath)
                .itag(itag)
                .downloadMode(downloadMode)
                .saveCover(saveCover)
                .coverSize(coverSize)
                .coverFormat(coverFormat)
                .coverQuality(coverQuality)
                .templateFolder(templateFolder)
                .templateFile(templateFile)
                .templateDate(templateDate)
                .poToken(poToken)
                .excludeTags(excludeTags)
                .truncate(truncate)
                .overwrite(overwrite)
                .noSyncedLyrics(noSyncedLyrics)
                .build();
    }

    public synchronized void updateSettings(DownloaderSettings settings) {
        validate(settings);
        apply(settings);
        if (persistSettings) {
            saveConfig();
        }
    }

    // Загрузка конфигурации из файла
    public synchronized void loadConfig() {
        Path path = Paths.get(configFile);
        if (!Files.exists(path)) {
            // Файл не существует, используем значения по умолчанию
            saveConfig();
            return;
        }

        Properties props = new Properties();
        try (InputStream input = Files.newInputStream(path)) {
            props.load(input);
        } catch (IOException e) {
            log.error("Failed to read configuration file {}, keeping defaults: {}", path, e.getMessage());
            return;
        }

        DownloaderSettings defaults = snapshot();
        DownloaderSettings loaded;
        int limit;
        try {
            loaded = DownloaderSettings.builder()
                    .outputPath(props.getProperty("outputPath", defaults.getOutputPath()))
                    .tempPath(props.getProperty("tempPath", defaults.getTempPath()))
                    .cookiesPath(emptyToNull(props.getProperty("cookiesPath", defaults.getCookiesPath())))
                    .itag(props.getProperty("itag", defaults.getItag()))
                    .downloadMode(DownloadMode.valueOf(props.getProperty("downloadMode", defaults.getDownloadMode().name())))
                    .saveCover(Boolean.parseBoolean(props.getProperty("saveCover", String.valueOf(defaults.isSaveCover()))))
                    .coverSize(Integer.parseInt(props.getProperty("coverSize", String.valueOf(defaults.getCoverSize()))))
                    .coverFormat(CoverFormat.valueOf(props.getProperty("coverFormat", defaults.getCoverFormat().name())))
                    .coverQuality(Integer.parseInt(props.getProperty("coverQuality", String.valueOf(defaults.getCoverQuality()))))
                    .templateFolder(props.getProperty("templateFolder", defaults.getTemplateFolder()))
                    .templateFile(props.getProperty("templateFile", defaults.getTemplateFile()))
                    .templateDate(props.getProperty("templateDate", defaults.getTemplateDate()))
                    .poToken(emptyToNull(props.getProperty("poToken", defaults.getPoToken())))
                    .excludeTags(emptyToNull(props.getProperty("excludeTags", defaults.getExcludeTags())))
                    .truncate(parseOptionalInt(props.getProperty("truncate")))
                    .overwrite(Boolean.parseBoolean(props.getProperty("overwrite", String.valueOf(defaults.isOverwrite()))))
                    .noSyncedLyrics(Boolean.parseBoolean(
                            props.getProperty("noSyncedLyrics", String.valueOf(defaults.isNoSyncedLyrics()))))
                    .build();
            validate(loaded);
            limit = Integer.parseInt(props.getProperty("concurrentLimit", String.valueOf(concurrentLimit)).trim());
            if (limit < 1) {
                throw new ValidationException("Concurrent limit must be greater than 0");
            }
        } catch (IllegalArgumentException | ValidationException e) {
            // Испорченный файл не должен мешать запуску
            log.error("Invalid configuration file {}, keeping defaults: {}", path, e.getMessage());
            return;
        }

        apply(loaded);
        this.concurrentLimit = limit;
        log.info("Configuration loaded from {}", path.toAbsolutePath());
    }

    // Сохранение конфигурации в файл
    public synchronized void saveConfig() {
        Properties props = new Properties();
        props.setProperty("outputPath", outputPath);
        props.setProperty("tempPath", tempPath);
        props.setProperty("cookiesPath", nullToEmpty(cookiesPath));
        props.setProperty("itag", itag);
        props.setProperty("downloadMode", downloadMode.name());
        props.setProperty("saveCover", String.valueOf(saveCover));
        props.setProperty("coverSize", String.valueOf(coverSize));
        props.setProperty("coverFormat", coverFormat.name());
        props.setProperty("coverQuality", String.valueOf(coverQuality));
        props.setProperty("templateFolder", templateFolder);
        props.setProperty("templateFile", templateFile);
        props.setProperty("templateDate", templateDate);
        props.setProperty("poToken", nullToEmpty(poToken));
        props.setProperty("excludeTags", nullToEmpty(excludeTags));
        props.setProperty("truncate", truncate != null ? String.valueOf(truncate) : "");
        props.setProperty("overwrite", String.valueOf(overwrite));
        props.setProperty("noSyncedLyrics", String.valueOf(noSyncedLyrics));
        props.setProperty("concurrentLimit", String.valueOf(concurrentLimit));

        try (OutputStream output = Files.newOutputStream(Paths.get(configFile))) {
            props.store(output, "gytmdl queue configuration");
            log.info("Configuration saved successfully");
        } catch (IOException e) {
            throw new IllegalStateException("Failed to save configuration", e);
        }
    }

    private static void validate(DownloaderSettings settings) {
        if (settings.getOutputPath() == null || settings.getOutputPath().isBlank()) {
            throw new ValidationException("Output path is required");
        }
        if (settings.getTempPath() == null || settings.getTempPath().isBlank()) {
            throw new ValidationException("Temp path is required");
        }
        if (settings.getItag() == null || settings.getItag().isBlank()) {
            throw new ValidationException("Itag is required");
        }
        if (settings.getDownloadMode() == null || settings.getCoverFormat() == null) {
            throw new ValidationException("Download mode and cover format are required");
        }
        if (settings.getCoverSize() < 1) {
            throw new ValidationException("Cover size must be greater than 0");
        }
        if (settings.getCoverQuality() < 1 || settings.getCoverQuality() > 100) {
            throw new ValidationException("Cover quality must be between 1 and 100");
        }
        if (settings.getTruncate() != null && settings.getTruncate() < 1) {
            throw new ValidationException("Truncate must be greater than 0");
        }
        if (settings.getTemplateFolder() == null || settings.getTemplateFile() == null
                || settings.getTemplateDate() == null) {
            throw new ValidationException("Templates are required");
        }
    }

    private void apply(DownloaderSettings settings) {
        this.outputPath = settings.getOutputPath();
        this.tempPath = settings.getTempPath();
        this.cookiesPath = settings.getCookiesPath();
        this.itag = settings.getItag();
        this.downloadMode = settings.getDownloadMode();
        this.saveCover = settings.isSaveCover();
        this.coverSize = settings.getCoverSize();
        this.coverFormat = settings.getCoverFormat();
        this.coverQuality = settings.getCoverQuality();
        this.templateFolder = settings.getTemplateFolder();
        this.templateFile = settings.getTemplateFile();
        this.templateDate = settings.getTemplateDate();
        this.poToken = settings.getPoToken();
        this.excludeTags = settings.getExcludeTags();
        this.truncate = settings.getTruncate();
        this.overwrite = settings.isOverwrite();
        this.noSyncedLyrics = settings.isNoSyncedLyrics();
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static Integer parseOptionalInt(String value) {
        return value == null || value.isBlank() ? null : Integer.valueOf(value.trim());
    }
}
