package com.ai.flashcards.client;

import com.ai.flashcards.exception.GenerationErrorType;
import com.ai.flashcards.exception.GenerationException;
import com.ai.flashcards.model.Difficulty;
import com.ai.flashcards.model.Flashcard;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw model output into flashcards.
 *
 * <p>
 * Models wrap their JSON in prose or Markdown fences and disagree on key names,
 * so the payload is first located, then every card goes through
 * {@link #normalize(JsonNode, String)} before becoming a typed {@link Flashcard}.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlashcardResponseParser {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json|JSON)?\\s*([\\s\\S]*?)```");
    private static final Pattern FENCE_MARKER = Pattern.compile("```(?:json|JSON)?");

    private final ObjectMapper objectMapper;

    /**
     * Parses a model response into normalized flashcards.
     *
     * @param raw              raw model output
     * @param requestedSubject subject used for cards that do not name one
     * @throws GenerationException {@code invalid_response} when no usable card array is found
     */
    public List<Flashcard> parse(String raw, String requestedSubject) {
        JsonNode cards = extractCardArray(raw);

        List<Flashcard> result = new ArrayList<>();
        for (JsonNode card : cards) {
            Flashcard normalized = normalize(card, requestedSubject);
            if (normalized != null) {
                result.add(normalized);
            }
        }

        if (result.isEmpty()) {
            throw new GenerationException(GenerationErrorType.INVALID_RESPONSE,
                    "No valid flashcards were generated.");
        }
        if (result.size() < cards.size()) {
            log.debug("Discarded {} malformed card(s) out of {}", cards.size() - result.size(), cards.size());
        }
        return result;
    }

    /**
     * Maps one loosely-shaped card to a {@link Flashcard}. Accepts
     * {@code question/answer/topic} as well as {@code front/back/subject}.
     *
     * @return the card, or {@code null} when front or back is blank
     */
    public Flashcard normalize(JsonNode card, String requestedSubject) {
        if (card == null || !card.isObject()) {
            return null;
        }
        String front = firstText(card, "question", "front");
        String back = firstText(card, "answer", "back");
        if (front == null || back == null) {
            return null;
        }

        String subject = firstText(card, "topic", "subject");
        if (subject == null) {
            subject = requestedSubject;
        }
        Difficulty difficulty = Difficulty.find(firstText(card, "difficulty"))
                .orElse(Difficulty.INTERMEDIATE);

        List<String> tags = new ArrayList<>();
        JsonNode tagNode = card.get("tags");
        if (tagNode != null && tagNode.isArray()) {
            tagNode.forEach(t -> {
                if (t.isTextual() && !t.asText().isBlank()) {
                    tags.add(t.asText().trim());
                }
            });
        }
        if (tags.isEmpty() && subject != null) {
            tags.add(subject);
        }

        return Flashcard.builder()
                .front(front)
                .back(back)
                .subject(subject)
                .difficulty(difficulty)
                .tags(tags)
                .build();
    }

    private JsonNode extractCardArray(String raw) {
        if (raw == null || raw.isBlank()) {
            throw invalid("AI model returned an empty response.");
        }

        String text = raw;
        Matcher fenced = FENCED_BLOCK.matcher(text);
        if (fenced.find()) {
            text = fenced.group(1);
        }
        text = FENCE_MARKER.matcher(text).replaceAll("").trim();

        if (!text.startsWith("[") && !text.startsWith("{")) {
            text = firstBracketLiteral(text);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new GenerationException(GenerationErrorType.INVALID_RESPONSE,
                    "AI response is not valid JSON: " + e.getOriginalMessage(), e);
        }

        JsonNode cards = root;
        if (root != null && root.isObject()) {
            cards = root.get("flashcards");
        }
        if (cards == null || !cards.isArray() || cards.isEmpty()) {
            throw invalid("AI response does not contain a flashcard array.");
        }
        return cards;
    }

    /**
     * Returns the text from the first '[' or '{' up to the last matching closer.
     */
    private String firstBracketLiteral(String text) {
        int arrayStart = text.indexOf('[');
        int objectStart = text.indexOf('{');
        int start;
        char closer;
        if (arrayStart >= 0 && (objectStart < 0 || arrayStart < objectStart)) {
            start = arrayStart;
            closer = ']';
        } else if (objectStart >= 0) {
            start = objectStart;
            closer = '}';
        } else {
            throw invalid("No JSON payload found in AI response.");
        }
        int end = text.lastIndexOf(closer);
        if (end <= start) {
            throw invalid("Unterminated JSON payload in AI response.");
        }
        return text.substring(start, end + 1);
    }

    private static String firstText(JsonNode card, String... keys) {
        for (String key : keys) {
            JsonNode value = card.get(key);
            if (value != null && value.isTextual()) {
                String trimmed = value.asText().trim();
                if (!trimmed.isEmpty()) {
                    return trimmed;
                }
            }
        }
        return null;
    }

    private static GenerationException invalid(String message) {
        return new GenerationException(GenerationErrorType.INVALID_RESPONSE, message);
    }
}
