package com.ai.flashcards.model;

/**
 * Lifecycle states of a flashcard generation job.
 *
 * <pre>
 * PENDING → PROCESSING → {COMPLETED, FAILED}
 * </pre>
 *
 * No transition leaves a terminal state.
 */
public enum JobStatus {

    /** Job record created, processing not yet started. */
    PENDING,

    /** Pipeline is running. */
    PROCESSING,

    /** All stages finished; flashcards and exports are attached. */
    COMPLETED,

    /** A stage raised an unrecoverable error; see the job's error message. */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case PENDING -> next == PROCESSING || next == FAILED;
            case PROCESSING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
