package com.ai.flashcards.exception;

/**
 * Failure inside the durable cache tier. Never propagates past the cache service.
 */
public class CacheException extends RuntimeException {
    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
