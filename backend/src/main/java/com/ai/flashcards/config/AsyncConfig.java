package com.ai.flashcards.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Enables Spring's @Async support for flashcard jobs.
 *
 * Each submitted job runs on the {@code jobExecutor} pool, so the upload
 * request returns as soon as the job record exists. Text extraction gets its
 * own pool so a hung document parser can be abandoned on timeout without
 * starving job threads.
 */
@EnableAsync
@Configuration
public class AsyncConfig {

    @Bean(name = "jobExecutor")
    public ThreadPoolTaskExecutor jobExecutor(
            @Value("${flashcards.jobs.core-pool-size:4}") int corePoolSize,
            @Value("${flashcards.jobs.max-pool-size:8}") int maxPoolSize,
            @Value("${flashcards.jobs.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("flashcard-job-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "extractionExecutor")
    public ThreadPoolTaskExecutor extractionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("extract-");
        executor.initialize();
        return executor;
    }
}
