package com.example.ytmdl.controller;

import com.example.ytmdl.service.HistoryService;
import com.example.ytmdl.utils.model.DownloadJob;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/history")
@RequiredArgsConstructor
public class HistoryController {

    private final HistoryService historyService;

    @GetMapping
    public ResponseEntity<List<DownloadJob>> getHistory() {
        return ResponseEntity.ok(historyService.getDownloadHistory());
    }

    @DeleteMapping
    public ResponseEntity<Void> clearHistory() {
        historyService.clearDownloadHistory();
        return ResponseEntity.noContent().build();
    }
}
