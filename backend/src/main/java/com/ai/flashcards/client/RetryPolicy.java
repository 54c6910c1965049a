package com.ai.flashcards.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Exponential backoff settings for AI generation calls.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy {

    /**
     * Retries after the first attempt (2 → at most 3 calls).
     */
    @Builder.Default
    private int maxRetries = 2;

    /**
     * Delay before the first retry in milliseconds.
     */
    @Builder.Default
    private long baseDelayMs = 500;

    /**
     * Upper bound for any single delay in milliseconds.
     */
    @Builder.Default
    private long maxDelayMs = 3000;

    /**
     * Delay to wait after the failed attempt with the given 0-based index:
     * {@code min(baseDelay * 2^attempt, maxDelay)}.
     */
    public long delayForAttempt(int attempt) {
        long multiplier = 1L << Math.min(attempt, 30);
        return Math.min(baseDelayMs * multiplier, maxDelayMs);
    }

    public static RetryPolicy defaultPolicy() {
        return RetryPolicy.builder().build();
    }
}
