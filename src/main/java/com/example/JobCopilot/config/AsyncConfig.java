package com.example.JobCopilot.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for post-write reindexing (lexical search rows and vector embeddings).
 * Requests never wait on it.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "reindexExecutor")
    public ThreadPoolTaskExecutor reindexExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);

        // Tasks beyond this are rejected and logged by the runner
        executor.setQueueCapacity(100);

        executor.setThreadNamePrefix("reindex-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Reindex executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                executor.getQueueCapacity());

        return executor;
    }
}
