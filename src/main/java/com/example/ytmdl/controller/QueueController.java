package com.example.ytmdl.controller;

import com.example.ytmdl.exception.ValidationException;
import com.example.ytmdl.service.DownloadQueueService;
import com.example.ytmdl.utils.model.AddJobRequest;
import com.example.ytmdl.utils.model.AddJobResponse;
import com.example.ytmdl.utils.model.DownloadJob;
import com.example.ytmdl.utils.model.QueueState;
import com.example.ytmdl.utils.model.QueueStats;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/queue")
@RequiredArgsConstructor
public class QueueController {

    private final DownloadQueueService queueService;

    @GetMapping
    public ResponseEntity<QueueState> getQueue() {
        return ResponseEntity.ok(queueService.snapshot());
    }

    @GetMapping("/stats")
    public ResponseEntity<QueueStats> getStats() {
        return ResponseEntity.ok(queueService.stats());
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<DownloadJob> getJob(@PathVariable String jobId) {
        return ResponseEntity.ok(queueService.get(jobId));
    }

    @PostMapping
    public ResponseEntity<AddJobResponse> addJob(@Valid @RequestBody AddJobRequest request) {
        log.info("Received queue request for URL: {}", request.getUrl());
        try {
            String jobId = queueService.add(request.getUrl());
            return ResponseEntity.ok(new AddJobResponse(jobId, true, null));
        } catch (ValidationException e) {
            return ResponseEntity.badRequest().body(new AddJobResponse(null, false, e.getMessage()));
        }
    }

    @PostMapping("/{jobId}/retry")
    public ResponseEntity<Void> retryJob(@PathVariable String jobId) {
        queueService.retry(jobId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{jobId}/cancel")
    public ResponseEntity<Void> cancelJob(@PathVariable String jobId) {
        queueService.cancel(jobId);
        return ResponseEntity.accepted().build();
    }

    @DeleteMapping("/{jobId}")
    public ResponseEntity<Void> removeJob(@PathVariable String jobId) {
        queueService.remove(jobId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/pause")
    public ResponseEntity<Void> pause() {
        queueService.pause();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/resume")
    public ResponseEntity<Void> resume() {
        queueService.resume();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/clear-completed")
    public ResponseEntity<Map<String, Integer>> clearCompleted() {
        return ResponseEntity.ok(Map.of("removed", queueService.clearCompleted()));
    }

    @PostMapping("/clear-all")
    public ResponseEntity<Map<String, Integer>> clearAll() {
        return ResponseEntity.ok(Map.of("removed", queueService.clearAll()));
    }

    @PostMapping("/cancel-all")
    public ResponseEntity<Map<String, Integer>> cancelAll() {
        return ResponseEntity.ok(Map.of("cancelled", queueService.cancelAll()));
    }

    @PostMapping("/retry-failed")
    public ResponseEntity<Map<String, Integer>> retryFailed() {
        return ResponseEntity.ok(Map.of("retried", queueService.retryAllFailed()));
    }

    @PutMapping("/concurrent-limit")
    public ResponseEntity<Map<String, Integer>> setConcurrentLimit(@RequestBody Map<String, Integer> body) {
        Integer limit = body.get("limit");
        if (limit == null) {
            throw new ValidationException("Field 'limit' is required");
        }
        queueService.setConcurrentLimit(limit);
        return ResponseEntity.ok(Map.of("limit", limit));
    }

    @GetMapping("/health")
    public ResponseEntity<String> healthCheck() {
        return ResponseEntity.ok(queueService.healthCheck());
    }

    @GetMapping("/dry-run")
    public ResponseEntity<String> dryRun(@RequestParam String url) {
        return ResponseEntity.ok(queueService.dryRun(url));
    }
}
