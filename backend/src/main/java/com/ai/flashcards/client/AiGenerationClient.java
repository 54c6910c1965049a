package com.ai.flashcards.client;

import com.ai.flashcards.exception.GenerationErrorType;
import com.ai.flashcards.exception.GenerationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Wraps {@link LlmClient} with error classification and exponential backoff.
 *
 * <p>
 * {@code rate_limit}, {@code server_error} and {@code network_error} are retried
 * up to {@link RetryPolicy#getMaxRetries()} times; every other class fails
 * immediately. When retries run out the last classified error is rethrown
 * unchanged.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AiGenerationClient {

    private final LlmClient llmClient;
    private final RetryPolicy retryPolicy;
    private final BackoffSleeper sleeper;

    /**
     * Calls the model and returns its raw text output.
     *
     * @throws GenerationException  classified failure after retries are exhausted
     *                              or on the first terminal error
     * @throws InterruptedException if interrupted while calling or backing off
     */
    public String generate(String prompt, String model, String credential) throws InterruptedException {
        for (int attempt = 0;; attempt++) {
            try {
                String raw = callOnce(prompt, model, credential);
                if (attempt > 0) {
                    log.info("LLM call succeeded on attempt {}", attempt + 1);
                }
                return raw;
            } catch (GenerationException e) {
                if (!e.isRetryable() || attempt >= retryPolicy.getMaxRetries()) {
                    log.warn("LLM call failed permanently after {} attempt(s): [{}] {}",
                            attempt + 1, e.getType().getCode(), e.getMessage());
                    throw e;
                }
                long delay = retryPolicy.delayForAttempt(attempt);
                log.warn("LLM call attempt {} failed with {}; retrying in {}ms",
                        attempt + 1, e.getType().getCode(), delay);
                sleeper.sleep(delay);
            }
        }
    }

    private String callOnce(String prompt, String model, String credential) throws InterruptedException {
        String raw;
        try {
            raw = llmClient.call(prompt, model, credential);
        } catch (LlmApiException e) {
            throw new GenerationException(
                    GenerationErrorType.fromStatus(e.getStatusCode(), e.getResponseBody()), e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new GenerationException(GenerationErrorType.INVALID_RESPONSE,
                    "AI service returned a malformed payload: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new GenerationException(GenerationErrorType.NETWORK_ERROR,
                    "AI service unreachable: " + e.getMessage(), e);
        }

        if (raw == null || raw.isBlank()) {
            throw new GenerationException(GenerationErrorType.INVALID_RESPONSE,
                    "AI model returned an empty response.");
        }
        return raw;
    }
}
