package com.ai.flashcards.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Target learner level for a generated deck and for individual cards.
 */
public enum Difficulty {
    BEGINNER("beginner"),
    INTERMEDIATE("intermediate"),
    ADVANCED("advanced");

    private final String value;

    Difficulty(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient lookup used when reading AI output; unknown values yield empty.
     */
    public static Optional<Difficulty> find(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(d -> d.value.equals(normalized))
                .findFirst();
    }

    @JsonCreator
    public static Difficulty fromValue(String raw) {
        return find(raw).orElseThrow(() ->
                new IllegalArgumentException("Unknown difficulty: " + raw));
    }
}
