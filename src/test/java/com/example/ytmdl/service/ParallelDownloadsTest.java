package com.example.ytmdl.service;

import com.example.ytmdl.config.ApplicationConfig;
import com.example.ytmdl.config.QueueProperties;
import com.example.ytmdl.utils.model.DownloadJob;
import com.example.ytmdl.utils.model.JobStatus;
import com.example.ytmdl.utils.model.QueueStats;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ParallelDownloadsTest {
    private static final int JOBS = 40;

    @TempDir
    Path tempDir;

    private ThreadPoolTaskExecutor executor;
    private DownloadQueueService queue;

    @BeforeEach
    void setUp() throws Exception {
        Path script = tempDir.resolve("slow.sh");
        Files.writeString(script, "#!/bin/sh\necho 'Starting download'\nsleep 1\nexit 0\n");
        assertTrue(script.toFile().setExecutable(true));

        ApplicationConfig appConfig = new ApplicationConfig();
        appConfig.setPersistSettings(false);
        appConfig.setOutputPath(tempDir.resolve("out").toString());
        appConfig.setConcurrentLimit(JOBS);

        QueueProperties queueProperties = new QueueProperties();
        queueProperties.setCancelGracePeriod(Duration.ofMillis(200));
        executor = queueProperties.runnerExecutor();

        ProcessRunnerService runner = new ProcessRunnerService(new CommandBuilderService(),
                new ProgressParsingService(), queueProperties, executor, script.toString());
        queue = new DownloadQueueService(appConfig, queueProperties, runner, new JobStateMachine(),
                new UrlValidationService(queueProperties), new CommandBuilderService(),
                new UtilityService(script.toString()), event -> { }, Clock.systemDefaultZone());
        queue.start();
    }

    @AfterEach
    void tearDown() {
        queue.shutdown();
        executor.shutdown();
    }

    @Test
    void everyJobWithinTheLimitGetsItsOwnProcess() throws Exception {
        for (int i = 0; i < JOBS; i++) {
            queue.add("https://music.youtube.com/watch?v=track" + i);
        }
        assertEquals(JOBS, queue.stats().getRunning());

        long deadline = System.currentTimeMillis() + 30_000;
        while (queue.stats().getCompleted() + queue.stats().getFailed() < JOBS
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }

        QueueStats stats = queue.stats();
        String errors = queue.snapshot().getJobs().stream()
                .filter(job -> job.getStatus() == JobStatus.FAILED)
                .map(DownloadJob::getError)
                .distinct()
                .reduce("", (a, b) -> a + b + "; ");
        assertEquals(0, stats.getFailed(), errors);
        assertEquals(JOBS, stats.getCompleted());
    }
}
