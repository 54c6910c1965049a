package com.ai.flashcards.exception;

import java.time.LocalDate;

/**
 * Thrown when a user's monthly upload or page budget is used up.
 */
public class QuotaExceededException extends RuntimeException {

    private final LocalDate nextResetDate;
    private final long daysUntilReset;

    public QuotaExceededException(String message, LocalDate nextResetDate, long daysUntilReset) {
        super(message);
        this.nextResetDate = nextResetDate;
        this.daysUntilReset = daysUntilReset;
    }

    public LocalDate getNextResetDate() {
        return nextResetDate;
    }

    public long getDaysUntilReset() {
        return daysUntilReset;
    }
}
