package com.ai.flashcards.export;

import com.ai.flashcards.model.ExportFormat;
import com.ai.flashcards.model.Flashcard;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.util.List;

/**
 * Turns a job's flashcards into a downloadable artifact.
 */
public interface FlashcardExporter {

    /**
     * @return a reference to the written artifact
     */
    String produce(String jobId, List<Flashcard> flashcards, ExportFormat format) throws IOException;

    /**
     * Opens an artifact previously returned by {@link #produce} for download.
     *
     * @throws java.nio.file.NoSuchFileException if the artifact no longer exists
     */
    Resource open(String reference) throws IOException;
}
