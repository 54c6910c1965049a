package com.ai.flashcards.service;

import com.ai.flashcards.model.Difficulty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the per-chunk generation prompt.
 */
@Component
public class FlashcardPromptBuilder {

    public String build(String chunk, int cardCount, String subject, Difficulty difficulty,
            Map<String, Boolean> focusAreas, String customContext) {

        String level = difficulty.getValue();
        String focus = describeFocusAreas(focusAreas);
        String extra = (customContext == null || customContext.isBlank())
                ? ""
                : "Additional instructions from the learner:\n" + customContext.trim() + "\n\n";

        return """
                Analyze the following %s study material and create exactly %d high-quality flashcards for %s level learners.

                Focus areas: %s

                %sContent to analyze:
                \"\"\"
                %s
                \"\"\"

                Instructions:
                1. Make questions specific and testable
                2. Keep answers concise but complete
                3. Use only facts stated in the content
                4. Do not ask the same question twice in different words
                5. Target %s difficulty

                Response format (JSON only):
                {
                  "flashcards": [
                    {
                      "question": "Clear, specific question",
                      "answer": "Concise answer",
                      "topic": "Brief topic category",
                      "difficulty": "%s"
                    }
                  ]
                }
                """.formatted(subject, cardCount, level,
                focus.isEmpty() ? "Key concepts of " + subject : focus,
                extra, chunk, level, level);
    }

    static String describeFocusAreas(Map<String, Boolean> focusAreas) {
        if (focusAreas == null) {
            return "";
        }
        return focusAreas.entrySet().stream()
                .filter(e -> Boolean.TRUE.equals(e.getValue()))
                .map(Map.Entry::getKey)
                .sorted()
                .map(FlashcardPromptBuilder::humanize)
                .collect(Collectors.joining(", "));
    }

    // camelCase flag names read as words: "keyTerms" → "key terms"
    private static String humanize(String flag) {
        return flag.replaceAll("([a-z])([A-Z])", "$1 $2").toLowerCase();
    }
}
