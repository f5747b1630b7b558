package com.apicatalog.collectionsync.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Two pools: {@code syncExecutor} only ever runs subtree apply tasks, {@code schemaChangeExecutor}
 * runs the {@code @Async} schema-change handling. A handler waits on apply tasks while holding the
 * sync lock, so it must never occupy a {@code syncExecutor} thread.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String SCHEMA_CHANGE_EXECUTOR = "schemaChangeExecutor";

    // Bounds how many top-level subtrees are written to the remote store at once
    @Value("${catalog.sync.concurrency:4}")
    private int concurrency;

    @Value("${catalog.schema.change-queue-capacity:100}")
    private int changeQueueCapacity;

    @Bean(name = "syncExecutor")
    public ThreadPoolTaskExecutor syncExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, concurrency));
        executor.setMaxPoolSize(Math.max(1, concurrency));
        executor.setThreadNamePrefix("collection-sync-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    // Single thread: schema changes are handled one after the other, in arrival order
    @Bean(name = SCHEMA_CHANGE_EXECUTOR)
    public ThreadPoolTaskExecutor schemaChangeExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(Math.max(1, changeQueueCapacity));
        executor.setThreadNamePrefix("schema-change-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
