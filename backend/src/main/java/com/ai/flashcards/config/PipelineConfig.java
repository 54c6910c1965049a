package com.ai.flashcards.config;

import com.ai.flashcards.client.BackoffSleeper;
import com.ai.flashcards.client.RetryPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared collaborators of the generation pipeline.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryPolicy retryPolicy(
            @Value("${llm.retry.max-retries:2}") int maxRetries,
            @Value("${llm.retry.base-delay-ms:500}") long baseDelayMs,
            @Value("${llm.retry.max-delay-ms:3000}") long maxDelayMs) {
        return RetryPolicy.builder()
                .maxRetries(maxRetries)
                .baseDelayMs(baseDelayMs)
                .maxDelayMs(maxDelayMs)
                .build();
    }

    @Bean
    public BackoffSleeper backoffSleeper() {
        return BackoffSleeper.THREAD_SLEEP;
    }
}
