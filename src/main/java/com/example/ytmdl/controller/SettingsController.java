package com.example.ytmdl.controller;

import com.example.ytmdl.config.ApplicationConfig;
import com.example.ytmdl.utils.model.DownloaderSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
public class SettingsController {

    private final ApplicationConfig appConfig;

    @GetMapping
    public ResponseEntity<DownloaderSettings> getSettings() {
        return ResponseEntity.ok(appConfig.snapshot());
    }

    // Новые настройки применяются к следующим запускам, текущие загрузки не трогаем
    @PutMapping
    public ResponseEntity<DownloaderSettings> updateSettings(@RequestBody DownloaderSettings settings) {
        appConfig.updateSettings(settings);
        log.info("Downloader settings updated");
        return ResponseEntity.ok(appConfig.snapshot());
    }
}
