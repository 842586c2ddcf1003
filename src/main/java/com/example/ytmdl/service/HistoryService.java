package com.example.ytmdl.service;

import com.example.ytmdl.utils.model.DownloadJob;
import com.example.ytmdl.utils.model.JobChangedEvent;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Keeps finished jobs in a JSON file. Independent of the queue: removing a job from the queue does
 * not touch its history record.
 */
@Slf4j
@Service
public class HistoryService {
    private final boolean enabled;
    private final Path historyPath;
    private final boolean clearOnStartup;
    private final List<DownloadJob> downloadHistory = Collections.synchronizedList(new ArrayList<>());
    private final ObjectMapper objectMapper;

    public HistoryService(@Value("${app.history.enabled:true}") boolean enabled,
                          @Value("${app.history.file:download_history.json}") String historyFile,
                          @Value("${app.history.clear-on-startup:false}") boolean clearOnStartup) {
        this.enabled = enabled;
        this.historyPath = Paths.get(historyFile);
        this.clearOnStartup = clearOnStartup;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @PostConstruct
    public void loadDownloadHistory() {
        if (!enabled) {
            log.info("Download history disabled");
            return;
        }
        if (clearOnStartup) {
            clearDownloadHistory();
            return;
        }
        if (!Files.exists(historyPath)) {
            log.info("No download history file found, creating empty history");
            saveDownloadHistory();
            return;
        }

        try {
            List<DownloadJob> loadedHistory = objectMapper.readValue(historyPath.toFile(), new TypeReference<>() {});
            downloadHistory.clear();
            downloadHistory.addAll(loadedHistory);
            log.info("Loaded {} items from download history", downloadHistory.size());
        } catch (IOException e) {
            log.error("Error loading download history from {}. Starting with empty history.", historyPath, e);
            downloadHistory.clear();
            saveDownloadHistory();
        }
    }

    @EventListener
    public void onJobChanged(JobChangedEvent event) {
        if (!enabled || !event.getChange().isTerminal()) {
            return;
        }
        downloadHistory.add(new DownloadJob(event.getJob()));
        saveDownloadHistory();
    }

    public List<DownloadJob> getDownloadHistory() {
        synchronized (downloadHistory) {
            // новые выше старых
            return downloadHistory.stream()
                    .sorted(Comparator.comparing(HistoryService::finishedAt,
                            Comparator.nullsLast(Comparator.reverseOrder())))
                    .map(DownloadJob::new)
                    .collect(Collectors.toList());
        }
    }

    public void clearDownloadHistory() {
        downloadHistory.clear();
        saveDownloadHistory();
        log.info("Download history cleared");
    }

    private void saveDownloadHistory() {
        List<DownloadJob> historyForSave;
        synchronized (downloadHistory) {
            historyForSave = downloadHistory.stream()
                    .map(DownloadJob::new)
                    .collect(Collectors.toList());
        }

        try {
            Files.writeString(historyPath, objectMapper.writeValueAsString(historyForSave));
            log.debug("Saved {} items to download history file: {}", historyForSave.size(), historyPath.toAbsolutePath());
        } catch (IOException e) {
            log.error("Error saving download history to file: {}", e.getMessage(), e);
        }
    }

    private static LocalDateTime finishedAt(DownloadJob job) {
        return job.getCompletedAt() != null ? job.getCompletedAt() : job.getCreatedAt();
    }
}
