package com.ai.flashcards.service;

import com.ai.flashcards.exception.ExtractionException;
import com.ai.flashcards.model.ExtractionResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentExtractionServiceTest {

    private static final Path DOCUMENT = Path.of("upload-1.pdf");

    @Mock
    private TextExtractor textExtractor;

    private final SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("extract-test-");

    @Test
    void shouldReturnExtractorResult() throws Exception {
        ExtractionResult result = ExtractionResult.builder().text("Photosynthesis").pageCount(2).build();
        when(textExtractor.extract(DOCUMENT, 2)).thenReturn(result);

        DocumentExtractionService service = new DocumentExtractionService(textExtractor, executor, 5);

        assertThat(service.extract(DOCUMENT, 2)).isSameAs(result);
    }

    @Test
    void shouldPropagateIoFailuresUnchanged() throws Exception {
        ExtractionException failure = new ExtractionException("Cannot process encrypted PDF files.");
        when(textExtractor.extract(DOCUMENT, 2)).thenThrow(failure);

        DocumentExtractionService service = new DocumentExtractionService(textExtractor, executor, 5);

        assertThatThrownBy(() -> service.extract(DOCUMENT, 2)).isSameAs(failure);
    }

    @Test
    void shouldWrapUnexpectedFailures() throws Exception {
        when(textExtractor.extract(DOCUMENT, 2)).thenThrow(new IllegalStateException("font table corrupt"));

        DocumentExtractionService service = new DocumentExtractionService(textExtractor, executor, 5);

        assertThatThrownBy(() -> service.extract(DOCUMENT, 2))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("font table corrupt")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldCancelExtractionThatExceedsTimeout() throws Exception {
        // GIVEN an extractor that blocks until interrupted
        CountDownLatch interrupted = new CountDownLatch(1);
        when(textExtractor.extract(DOCUMENT, 2)).thenAnswer(inv -> {
            try {
                Thread.sleep(TimeUnit.MINUTES.toMillis(1));
                return null;
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw new IOException("interrupted");
            }
        });
        DocumentExtractionService service = new DocumentExtractionService(textExtractor, executor, 1);

        // WHEN / THEN
        assertThatThrownBy(() -> service.extract(DOCUMENT, 2))
                .isInstanceOf(ExtractionException.class)
                .hasMessage("Text extraction timed out after 1 seconds.");
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }
}
