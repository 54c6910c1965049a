package com.ai.flashcards.service;

import com.ai.flashcards.exception.ExtractionException;
import com.ai.flashcards.model.ExtractionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs text extraction on the extraction pool with a hard time limit. On
 * timeout the extraction task is cancelled with interruption and the job
 * sees an {@link ExtractionException}.
 */
@Slf4j
@Service
public class DocumentExtractionService {

    private final TextExtractor textExtractor;
    private final AsyncTaskExecutor extractionExecutor;
    private final long timeoutSeconds;

    public DocumentExtractionService(TextExtractor textExtractor,
            @Qualifier("extractionExecutor") AsyncTaskExecutor extractionExecutor,
            @Value("${flashcards.extraction.timeout-seconds:180}") long timeoutSeconds) {
        this.textExtractor = textExtractor;
        this.extractionExecutor = extractionExecutor;
        this.timeoutSeconds = timeoutSeconds;
    }

    public ExtractionResult extract(Path document, int maxPages) throws IOException, InterruptedException {
        Future<ExtractionResult> future = extractionExecutor.submit(() -> textExtractor.extract(document, maxPages));
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Text extraction timed out after {}s: {}", timeoutSeconds, document.getFileName());
            throw new ExtractionException("Text extraction timed out after " + timeoutSeconds + " seconds.", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new ExtractionException("Text extraction failed: " + cause.getMessage(), cause);
        }
    }
}
