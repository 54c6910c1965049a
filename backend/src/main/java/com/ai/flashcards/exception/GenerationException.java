package com.ai.flashcards.exception;

/**
 * Failure of an AI generation call, carrying its classification.
 */
public class GenerationException extends RuntimeException {

    private final GenerationErrorType type;

    public GenerationException(GenerationErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public GenerationException(GenerationErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public GenerationErrorType getType() {
        return type;
    }

    public boolean isRetryable() {
        return type.isRetryable();
    }
}
