package com.example.ytmdl.service;

import com.example.ytmdl.config.ApplicationConfig;
import com.example.ytmdl.config.QueueProperties;
import com.example.ytmdl.exception.JobNotFoundException;
import com.example.ytmdl.exception.ValidationException;
import com.example.ytmdl.utils.model.DownloadJob;
import com.example.ytmdl.utils.model.JobChangedEvent;
import com.example.ytmdl.utils.model.JobChangedEvent.Change;
import com.example.ytmdl.utils.model.JobStatus;
import com.example.ytmdl.utils.model.QueueState;
import com.example.ytmdl.utils.model.QueueStats;
import com.example.ytmdl.utils.model.RunnerEvent;
import com.example.ytmdl.utils.model.RunnerRequest;
import com.example.ytmdl.utils.model.RunnerResult;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Owns the download queue. All job state lives here and changes only under {@code lock}; runners
 * report back through {@code runnerEvents}, which a single dispatcher thread applies in arrival
 * order. Change notifications are queued inside the same critical section and published by a
 * separate notifier thread, so listeners see them in the order they happened.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DownloadQueueService {
    private final ApplicationConfig appConfig;
    private final QueueProperties queueProperties;
    private final DownloadRunner downloadRunner;
    private final JobStateMachine stateMachine;
    private final UrlValidationService urlValidationService;
    private final CommandBuilderService commandBuilderService;
    private final UtilityService utilityService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, QueueEntry> entries = new LinkedHashMap<>();
    private final BlockingQueue<RunnerEvent> runnerEvents = new LinkedBlockingQueue<>();
    private final BlockingQueue<JobChangedEvent> notifications = new LinkedBlockingQueue<>();

    // guarded by lock
    private long sequence;
    private int runningCount;
    private boolean paused;

    private ExecutorService dispatcher;
    private ExecutorService notifier;

    @PostConstruct
    public void start() {
        // Загружаем сохраненные настройки при старте
        if (appConfig.isPersistSettings()) {
            appConfig.loadConfig();
        }
        synchronized (lock) {
            paused = queueProperties.isPaused();
        }
        dispatcher = Executors.newSingleThreadExecutor(r -> new Thread(r, "queue-dispatcher"));
        notifier = Executors.newSingleThreadExecutor(r -> new Thread(r, "queue-notifier"));
        dispatcher.execute(this::drainRunnerEvents);
        notifier.execute(this::drainNotifications);
        log.info("Download queue started (limit {}, paused {})", appConfig.getConcurrentLimit(), paused);
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping download queue...");
        int stopping = cancelRunning();
        if (stopping > 0) {
            Duration wait = queueProperties.getCancelGracePeriod().plusSeconds(2);
            if (!awaitIdle(wait)) {
                log.warn("{} downloads still running after {}", runningCount(), wait);
            }
        }
        dispatcher.shutdownNow();
        notifier.shutdownNow();
        log.info("Download queue stopped");
    }

    public String add(String url) {
        String validated = urlValidationService.validate(url);
        String id = UUID.randomUUID().toString();

        synchronized (lock) {
            QueueEntry entry = new QueueEntry();
            entry.job = stateMachine.create(id, validated, entry.stamp(clock));
            entry.sequence = ++sequence;
            entries.put(id, entry);
            log.info("Job {} queued: {}", id, validated);
            publish(Change.ADDED, entry);
            schedule();
        }
        return id;
    }

    public void retry(String jobId) {
        synchronized (lock) {
            QueueEntry entry = require(jobId);
            stateMachine.retry(entry.job);
            entry.sequence = ++sequence;
            log.info("Job {} queued again (retry #{})", jobId, entry.job.getRetryCount());
            publish(Change.REQUEUED, entry);
            schedule();
        }
    }

    public void cancel(String jobId) {
        Map<String, RunnerHandle> toStop = new LinkedHashMap<>();
        synchronized (lock) {
            cancelEntry(require(jobId), toStop);
        }
        stopRunners(toStop);
    }

    public void remove(String jobId) {
        synchronized (lock) {
            QueueEntry entry = require(jobId);
            stateMachine.checkRemovable(entry.job);
            entries.remove(jobId);
            log.info("Job {} removed", jobId);
            publish(Change.REMOVED, entry);
        }
    }

    public void pause() {
        synchronized (lock) {
            if (!paused) {
                paused = true;
                log.info("Queue paused");
            }
        }
    }

    public void resume() {
        synchronized (lock) {
            if (paused) {
                paused = false;
                log.info("Queue resumed");
            }
            schedule();
        }
    }

    public int clearCompleted() {
        synchronized (lock) {
            int removed = removeWhere(entry -> entry.job.getStatus().isTerminal());
            log.info("Cleared {} finished jobs", removed);
            return removed;
        }
    }

    public int clearAll() {
        synchronized (lock) {
            int removed = removeWhere(entry -> entry.job.getStatus() != JobStatus.RUNNING);
            log.info("Cleared {} jobs", removed);
            return removed;
        }
    }

    public int cancelAll() {
        Map<String, RunnerHandle> toStop = new LinkedHashMap<>();
        int cancelled = 0;
        synchronized (lock) {
            for (QueueEntry entry : new ArrayList<>(entries.values())) {
                if (!entry.job.getStatus().isTerminal()) {
                    cancelEntry(entry, toStop);
                    cancelled++;
                }
            }
        }
        stopRunners(toStop);
        return cancelled;
    }

    public int retryAllFailed() {
        synchronized (lock) {
            List<String> failed = entries.values().stream()
                    .filter(entry -> entry.job.getStatus() == JobStatus.FAILED)
                    .map(entry -> entry.job.getId())
                    .collect(Collectors.toList());
            failed.forEach(this::retry);
            return failed.size();
        }
    }

    public void setConcurrentLimit(int limit) {
        if (limit < 1) {
            throw new ValidationException("Concurrent limit must be greater than 0");
        }
        synchronized (lock) {
            appConfig.setConcurrentLimit(limit);
            log.info("Concurrent limit set to {}", limit);
            schedule();
        }
        if (appConfig.isPersistSettings()) {
            appConfig.saveConfig();
        }
    }

    public QueueState snapshot() {
        synchronized (lock) {
            List<DownloadJob> jobs = entries.values().stream()
                    .map(entry -> new DownloadJob(entry.job))
                    .collect(Collectors.toList());
            return new QueueState(jobs, paused, appConfig.getConcurrentLimit());
        }
    }

    public DownloadJob get(String jobId) {
        synchronized (lock) {
            return new DownloadJob(require(jobId).job);
        }
    }

    public QueueStats stats() {
        synchronized (lock) {
            Map<JobStatus, Long> counts = entries.values().stream()
                    .collect(Collectors.groupingBy(entry -> entry.job.getStatus(), Collectors.counting()));
            return new QueueStats(
                    entries.size(),
                    counts.getOrDefault(JobStatus.QUEUED, 0L).intValue(),
                    counts.getOrDefault(JobStatus.RUNNING, 0L).intValue(),
                    counts.getOrDefault(JobStatus.COMPLETED, 0L).intValue(),
                    counts.getOrDefault(JobStatus.FAILED, 0L).intValue(),
                    counts.getOrDefault(JobStatus.CANCELLED, 0L).intValue(),
                    paused,
                    appConfig.getConcurrentLimit());
        }
    }

    public String healthCheck() {
        try {
            return "Queue manager healthy. gytmdl version: " + utilityService.getGytmdlVersion();
        } catch (IOException e) {
            log.warn("Health check failed: {}", e.getMessage());
            return "Health check failed: " + e.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "Health check interrupted";
        }
    }

    public String dryRun(String url) {
        String validated = urlValidationService.validate(url);
        List<String> command = commandBuilderService.buildCommand(
                utilityService.getBinaryPath(), appConfig.snapshot(), validated);
        return commandBuilderService.describe(command);
    }

    int runningCount() {
        synchronized (lock) {
            return runningCount;
        }
    }

    boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (lock) {
            while (runningCount > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                try {
                    TimeUnit.NANOSECONDS.timedWait(lock, remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return true;
        }
    }

    private int cancelRunning() {
        Map<String, RunnerHandle> toStop = new LinkedHashMap<>();
        int count = 0;
        synchronized (lock) {
            for (QueueEntry entry : entries.values()) {
                if (entry.job.getStatus() == JobStatus.RUNNING) {
                    cancelEntry(entry, toStop);
                    count++;
                }
            }
        }
        stopRunners(toStop);
        return count;
    }

    // Сигналы процессам отправляются уже без блокировки
    private void stopRunners(Map<String, RunnerHandle> runners) {
        runners.forEach((jobId, runner) -> {
            try {
                runner.cancel();
            } catch (RuntimeException e) {
                log.error("Runner of job {} rejected cancellation: {}", jobId, e.getMessage(), e);
            }
        });
    }

    // lock held
    private void cancelEntry(QueueEntry entry, Map<String, RunnerHandle> toStop) {
        DownloadJob job = entry.job;
        switch (job.getStatus()) {
            case QUEUED -> {
                stateMachine.cancelQueued(job, entry.stamp(clock));
                log.info("Job {} cancelled before start", job.getId());
                publish(Change.CANCELLED, entry);
            }
            case RUNNING -> {
                if (entry.cancelRequested) {
                    return;
                }
                entry.cancelRequested = true;
                log.info("Cancelling running job {}", job.getId());
                publish(Change.CANCEL_REQUESTED, entry);
                toStop.put(job.getId(), entry.runner);
            }
            default -> {
                // уже завершена, отменять нечего
            }
        }
    }

    // lock held
    private void schedule() {
        if (paused) {
            return;
        }
        while (runningCount < appConfig.getConcurrentLimit()) {
            QueueEntry next = entries.values().stream()
                    .filter(entry -> entry.job.getStatus() == JobStatus.QUEUED)
                    .min(Comparator.comparingLong(entry -> entry.sequence))
                    .orElse(null);
            if (next == null) {
                return;
            }
            dispatch(next);
        }
    }

    // lock held
    private void dispatch(QueueEntry entry) {
        DownloadJob job = entry.job;
        stateMachine.dispatch(job, entry.stamp(clock));
        entry.runId++;
        entry.cancelRequested = false;
        runningCount++;
        log.info("Dispatching job {} ({}/{} running)", job.getId(), runningCount, appConfig.getConcurrentLimit());
        publish(Change.STARTED, entry);

        RunnerRequest request = new RunnerRequest(job.getId(), entry.runId, job.getUrl(), appConfig.snapshot());
        try {
            entry.runner = downloadRunner.start(request, runnerEvents::add);
        } catch (RuntimeException e) {
            log.error("Failed to start runner for job {}: {}", job.getId(), e.getMessage(), e);
            stateMachine.fail(job, "Failed to start download: " + e.getMessage(), entry.stamp(clock));
            release(entry);
            publish(Change.FAILED, entry);
        }
    }

    private void drainRunnerEvents() {
        while (!Thread.currentThread().isInterrupted()) {
            RunnerEvent event;
            try {
                event = runnerEvents.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            applyRunnerEvent(event);
        }
    }

    private void applyRunnerEvent(RunnerEvent event) {
        Map<String, RunnerHandle> toStop = new LinkedHashMap<>();
        synchronized (lock) {
            QueueEntry entry = entries.get(event.getJobId());
            if (entry == null || entry.runId != event.getRunId() || entry.job.getStatus() != JobStatus.RUNNING) {
                log.debug("Ignoring stale runner event for job {}", event.getJobId());
                return;
            }

            try {
                if (event.isTerminal()) {
                    finishRun(entry, event.getResult());
                } else {
                    stateMachine.updateProgress(entry.job, event.getProgress());
                    publish(Change.PROGRESS, entry);
                }
            } catch (RuntimeException e) {
                log.error("Failed to apply runner event for job {}: {}", event.getJobId(), e.getMessage(), e);
                abortRun(entry, "Internal error: " + e.getMessage(), toStop);
            }
            schedule();
        }
        stopRunners(toStop);
    }

    // lock held
    private void finishRun(QueueEntry entry, RunnerResult result) {
        DownloadJob job = entry.job;
        LocalDateTime now = entry.stamp(clock);
        Change change;

        if (result.getKind() == RunnerResult.Kind.SUCCESS) {
            stateMachine.complete(job, result.getMetadata(), now);
            change = Change.COMPLETED;
            log.info("Job {} completed", job.getId());
        } else if (entry.cancelRequested) {
            stateMachine.acknowledgeCancel(job, now);
            change = Change.CANCELLED;
            log.info("Job {} cancelled", job.getId());
        } else if (result.getKind() == RunnerResult.Kind.CANCELLED) {
            stateMachine.fail(job, "Download process was terminated unexpectedly", now);
            change = Change.FAILED;
            log.warn("Job {} stopped without a cancel request", job.getId());
        } else {
            stateMachine.fail(job, result.getMessage(), now);
            change = Change.FAILED;
            log.warn("Job {} failed ({}): {}", job.getId(), result.getKind(), result.getMessage());
        }
        release(entry);
        publish(change, entry);
    }

    // lock held
    private void abortRun(QueueEntry entry, String error, Map<String, RunnerHandle> toStop) {
        if (entry.job.getStatus() != JobStatus.RUNNING) {
            return;
        }
        if (entry.runner != null) {
            toStop.put(entry.job.getId(), entry.runner);
        }
        stateMachine.fail(entry.job, error, entry.stamp(clock));
        release(entry);
        publish(Change.FAILED, entry);
    }

    // lock held
    private void release(QueueEntry entry) {
        entry.runner = null;
        entry.cancelRequested = false;
        runningCount--;
        lock.notifyAll();
    }

    // lock held
    private int removeWhere(Predicate<QueueEntry> condition) {
        int removed = 0;
        Iterator<QueueEntry> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            QueueEntry entry = iterator.next();
            if (condition.test(entry)) {
                iterator.remove();
                publish(Change.REMOVED, entry);
                removed++;
            }
        }
        return removed;
    }

    // lock held
    private QueueEntry require(String jobId) {
        QueueEntry entry = jobId != null ? entries.get(jobId) : null;
        if (entry == null) {
            throw new JobNotFoundException(jobId);
        }
        return entry;
    }

    // lock held
    private void publish(Change change, QueueEntry entry) {
        notifications.add(new JobChangedEvent(change, new DownloadJob(entry.job)));
    }

    private void drainNotifications() {
        while (!Thread.currentThread().isInterrupted()) {
            JobChangedEvent event;
            try {
                event = notifications.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            try {
                eventPublisher.publishEvent(event);
            } catch (RuntimeException e) {
                log.error("Listener failed on {} of job {}: {}",
                        event.getChange(), event.getJob().getId(), e.getMessage(), e);
            }
        }
    }

    private static final class QueueEntry {
        private DownloadJob job;
        private long sequence;
        private long runId;
        private RunnerHandle runner;
        private boolean cancelRequested;
        private LocalDateTime lastStamp;

        // Метки времени задачи никогда не идут назад
        private LocalDateTime stamp(Clock clock) {
            LocalDateTime now = LocalDateTime.now(clock);
            if (lastStamp != null && !now.isAfter(lastStamp)) {
                now = lastStamp.plusNanos(1_000);
            }
            lastStamp = now;
            return now;
        }
    }
}
