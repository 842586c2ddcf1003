package com.example.ytmdl.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "app.queue")
public class QueueProperties {
    private boolean paused = false;
    private Duration cancelGracePeriod = Duration.ofSeconds(5);
    private List<String> acceptedHosts = List.of("music.youtube.com", "www.youtube.com", "youtube.com",
            "m.youtube.com", "youtu.be");
    private List<String> acceptedPaths = List.of("/watch", "/playlist", "/browse", "/channel");

    // Каждый запуск загрузчика держит поток до выхода процесса, число запусков ограничивает очередь
    @Bean
    public ThreadPoolTaskExecutor runnerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(0);
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("gytmdl-runner-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
