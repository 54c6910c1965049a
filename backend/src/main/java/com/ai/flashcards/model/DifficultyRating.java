package com.ai.flashcards.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How hard the learner found a card on its last review.
 */
public enum DifficultyRating {
    EASY("easy", 2.8),
    MEDIUM("medium", 2.5),
    HARD("hard", 2.2);

    private final String value;
    private final double easeFactor;

    DifficultyRating(String value, double easeFactor) {
        this.value = value;
        this.easeFactor = easeFactor;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public double getEaseFactor() {
        return easeFactor;
    }

    /** Missing or unrecognised ratings count as medium. */
    @JsonCreator
    public static DifficultyRating fromValue(String raw) {
        if (raw == null) {
            return MEDIUM;
        }
        return switch (raw.trim().toLowerCase()) {
            case "easy" -> EASY;
            case "hard" -> HARD;
            default -> MEDIUM;
        };
    }
}
