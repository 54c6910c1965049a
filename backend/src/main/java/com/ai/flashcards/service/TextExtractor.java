package com.ai.flashcards.service;

import com.ai.flashcards.model.ExtractionResult;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads the text layer of a stored document.
 */
public interface TextExtractor {

    /**
     * @param document path of the spooled upload
     * @param maxPages read at most this many pages from the start of the document
     * @throws com.ai.flashcards.exception.ExtractionException if the document is unreadable
     */
    ExtractionResult extract(Path document, int maxPages) throws IOException;

    /**
     * Counts pages without extracting text. Used by upload validation before
     * quota is checked.
     */
    int countPages(Path document) throws IOException;
}
