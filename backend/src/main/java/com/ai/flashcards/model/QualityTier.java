package com.ai.flashcards.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Generation quality requested for a job. {@code ADVANCED} selects the stronger model
 * and requires an active subscription.
 */
public enum QualityTier {
    BASIC("basic"),
    ADVANCED("advanced");

    private final String value;

    QualityTier(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static QualityTier fromValue(String raw) {
        return Arrays.stream(values())
                .filter(t -> raw != null && t.value.equals(raw.trim().toLowerCase()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown quality tier: " + raw));
    }
}
