package com.ai.flashcards.exception;

/**
 * Thrown when a job submission is malformed. Raised before any job record exists.
 */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }
}
