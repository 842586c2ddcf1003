package com.example.ytmdl.service;

import com.example.ytmdl.config.QueueProperties;
import com.example.ytmdl.utils.model.DownloaderSettings;
import com.example.ytmdl.utils.model.JobMetadata;
import com.example.ytmdl.utils.model.RunnerEvent;
import com.example.ytmdl.utils.model.RunnerRequest;
import com.example.ytmdl.utils.model.RunnerResult;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Runs the gytmdl executable, one OS process per run.
 */
@Slf4j
@Service
public class ProcessRunnerService implements DownloadRunner {
    private final CommandBuilderService commandBuilderService;
    private final ProgressParsingService progressParsingService;
    private final QueueProperties queueProperties;
    private final Executor runnerExecutor;
    private final String binaryPath;
    private final ScheduledExecutorService killScheduler;

    public ProcessRunnerService(CommandBuilderService commandBuilderService,
                                ProgressParsingService progressParsingService,
                                QueueProperties queueProperties,
                                @Qualifier("runnerExecutor") Executor runnerExecutor,
                                @Value("${gytmdl.path}") String binaryPath) {
        this.commandBuilderService = commandBuilderService;
        this.progressParsingService = progressParsingService;
        this.queueProperties = queueProperties;
        this.runnerExecutor = runnerExecutor;
        this.binaryPath = binaryPath;
        this.killScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "gytmdl-killer");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public RunnerHandle start(RunnerRequest request, Consumer<RunnerEvent> channel) {
        ProcessRun run = new ProcessRun(request, channel);
        try {
            runnerExecutor.execute(run::supervise);
        } catch (RejectedExecutionException e) {
            log.error("No runner thread available for job {}: {}", request.getJobId(), e.getMessage());
            run.finish(RunnerResult.spawnError("No runner thread available: " + e.getMessage()));
        }
        return run;
    }

    @PreDestroy
    public void shutdown() {
        killScheduler.shutdownNow();
    }

    private final class ProcessRun implements RunnerHandle {
        private final RunnerRequest request;
        private final Consumer<RunnerEvent> channel;
        private final AtomicBoolean finished = new AtomicBoolean();
        private final JobMetadata metadata = new JobMetadata();
        private String lastErrorLine;

        // guarded by this
        private Process process;
        private boolean cancelRequested;

        private ProcessRun(RunnerRequest request, Consumer<RunnerEvent> channel) {
            this.request = request;
            this.channel = channel;
        }

        @Override
        public void cancel() {
            Process target;
            synchronized (this) {
                if (cancelRequested) {
                    return;
                }
                cancelRequested = true;
                target = process;
            }
            log.info("Cancellation requested for job {}", request.getJobId());
            if (target != null) {
                terminate(target);
            }
        }

        void supervise() {
            try {
                finish(execute());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                Process target = currentProcess();
                if (target != null) {
                    forceStop(target, target.descendants().collect(Collectors.toList()));
                }
                finish(isCancelRequested()
                        ? RunnerResult.cancelled()
                        : RunnerResult.executionError("Runner interrupted", null));
            } catch (RuntimeException e) {
                log.error("Runner for job {} crashed: {}", request.getJobId(), e.getMessage(), e);
                finish(isCancelRequested()
                        ? RunnerResult.cancelled()
                        : RunnerResult.executionError("Runner crashed: " + e.getMessage(), null));
            }
        }

        void finish(RunnerResult result) {
            if (finished.compareAndSet(false, true)) {
                channel.accept(RunnerEvent.finished(request.getJobId(), request.getRunId(), result));
            }
        }

        private RunnerResult execute() throws InterruptedException {
            String jobId = request.getJobId();
            DownloaderSettings settings = request.getSettings();
            List<String> command = commandBuilderService.buildCommand(binaryPath, settings, request.getUrl());

            Path workDir = Paths.get(settings.getOutputPath());
            try {
                Files.createDirectories(workDir);
            } catch (IOException e) {
                return RunnerResult.spawnError("Cannot create output directory " + workDir + ": " + e.getMessage());
            }

            if (isCancelRequested()) {
                return RunnerResult.cancelled();
            }

            log.info("Download command for job {}: {}", jobId, commandBuilderService.describe(command));
            Process started;
            try {
                started = new ProcessBuilder(command)
                        .directory(workDir.toFile())
                        .redirectErrorStream(true)
                        .start();
            } catch (IOException e) {
                log.error("Failed to spawn gytmdl for job {}: {}", jobId, e.getMessage());
                return RunnerResult.spawnError("Failed to spawn gytmdl process: " + e.getMessage());
            }

            boolean cancelNow;
            synchronized (this) {
                process = started;
                cancelNow = cancelRequested;
            }
            if (cancelNow) {
                terminate(started);
            }

            try {
                started.getOutputStream().close();
            } catch (IOException e) {
                log.debug("Could not close stdin of gytmdl for job {}: {}", jobId, e.getMessage());
            }

            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(started.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    handleLine(line);
                }
            } catch (IOException e) {
                if (!isCancelRequested()) {
                    log.warn("Error reading gytmdl output for job {}: {}", jobId, e.getMessage());
                }
            }

            int exitCode = started.waitFor();
            if (isCancelRequested()) {
                log.info("gytmdl for job {} stopped after cancellation (exit code {})", jobId, exitCode);
                return RunnerResult.cancelled();
            }
            if (exitCode == 0) {
                log.info("gytmdl for job {} finished successfully", jobId);
                return RunnerResult.success(metadata.isEmpty() ? null : metadata);
            }

            String message = lastErrorLine != null ? lastErrorLine : "Process exited with code: " + exitCode;
            log.warn("gytmdl for job {} failed with exit code {}: {}", jobId, exitCode, message);
            return RunnerResult.executionError(message, exitCode);
        }

        private void handleLine(String rawLine) {
            String line = progressParsingService.sanitize(rawLine);
            if (line.isEmpty()) {
                return;
            }
            log.debug("gytmdl [{}]: {}", request.getJobId(), line);

            if (progressParsingService.collectMetadata(line, metadata)) {
                return;
            }
            if (progressParsingService.isErrorLine(line)) {
                lastErrorLine = line;
                log.warn("gytmdl error output for job {}: {}", request.getJobId(), line);
            }
            if (progressParsingService.isCompletionLine(line)) {
                log.info("gytmdl reported completion for job {}", request.getJobId());
            }
            progressParsingService.parse(line).ifPresent(progress ->
                    channel.accept(RunnerEvent.progress(request.getJobId(), request.getRunId(), progress)));
        }

        private void terminate(Process target) {
            List<ProcessHandle> tree = target.descendants().collect(Collectors.toList());
            log.info("Stopping gytmdl process {} for job {}", target.pid(), request.getJobId());
            tree.forEach(ProcessHandle::destroy);
            target.destroy();
            try {
                killScheduler.schedule(() -> forceStop(target, tree),
                        queueProperties.getCancelGracePeriod().toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                forceStop(target, tree);
            }
        }

        private void forceStop(Process target, List<ProcessHandle> tree) {
            boolean treeAlive = tree.stream().anyMatch(ProcessHandle::isAlive);
            if (!target.isAlive() && !treeAlive) {
                return;
            }
            log.warn("gytmdl process {} for job {} did not exit in time, killing it",
                    target.pid(), request.getJobId());
            tree.forEach(ProcessHandle::destroyForcibly);
            target.destroyForcibly();
        }

        private synchronized boolean isCancelRequested() {
            return cancelRequested;
        }

        private synchronized Process currentProcess() {
            return process;
        }
    }
}
