package com.ai.flashcards.service;

import com.ai.flashcards.model.Flashcard;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts the JSON text columns of a job to and from their Java shapes.
 */
@Component
@RequiredArgsConstructor
public class JobJsonMapper {

    private static final TypeReference<List<Flashcard>> FLASHCARDS = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, Boolean>> FOCUS_AREAS = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, String>> EXPORTS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public String writeFlashcards(List<Flashcard> flashcards) {
        return write(flashcards);
    }

    public List<Flashcard> readFlashcards(String json) {
        return json == null || json.isBlank() ? List.of() : read(json, FLASHCARDS);
    }

    public String writeFocusAreas(Map<String, Boolean> focusAreas) {
        return write(focusAreas == null ? Map.of() : focusAreas);
    }

    public Map<String, Boolean> readFocusAreas(String json) {
        return json == null || json.isBlank() ? new LinkedHashMap<>() : read(json, FOCUS_AREAS);
    }

    public String writeExportReferences(Map<String, String> references) {
        return write(references);
    }

    public Map<String, String> readExportReferences(String json) {
        return json == null || json.isBlank() ? null : read(json, EXPORTS);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize job data", e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Stored job data is not valid JSON", e);
        }
    }
}
