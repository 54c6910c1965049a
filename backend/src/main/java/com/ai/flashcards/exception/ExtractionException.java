package com.ai.flashcards.exception;

import java.io.IOException;

/**
 * The document could not be read: corrupt, encrypted, empty, or extraction timed out.
 */
public class ExtractionException extends IOException {
    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
