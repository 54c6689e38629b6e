package com.simod.discovery.service.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Async configuration.
 *
 * Callback delivery runs on its own small pool so a slow callback endpoint
 * never holds up a worker or a request thread.
 */
@Slf4j
@Configuration
@EnableAsync
public class AsyncConfig {

    // ==================== Executor Beans ====================

    /**
     * Executor for completion callbacks.
     */
    @Bean(name = "notificationExecutor")
    public Executor notificationExecutor() {
        log.info("Initializing notification executor with platform thread pool");
        return createPlatformThreadPool("notify-", 1, 4, 500);
    }

    // ==================== Helper Methods ====================

    private ThreadPoolTaskExecutor createPlatformThreadPool(String prefix, int coreSize,
                                                             int maxSize, int queueCapacity) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
