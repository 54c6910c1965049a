package com.ai.flashcards.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Learning state of one card for one user.
 */
public enum StudyStatus {
    NEW("new"),
    REVIEWING("reviewing"),
    KNOWN("known");

    private final String value;

    StudyStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * "unknown" and "learning" are the client's names for cards that have not
     * graduated yet and map to {@link #NEW}.
     */
    @JsonCreator
    public static StudyStatus fromValue(String raw) {
        if (raw == null) {
            return NEW;
        }
        return switch (raw.trim().toLowerCase()) {
            case "known" -> KNOWN;
            case "reviewing" -> REVIEWING;
            case "new", "unknown", "learning" -> NEW;
            default -> throw new IllegalArgumentException("Unknown study status: " + raw);
        };
    }
}
