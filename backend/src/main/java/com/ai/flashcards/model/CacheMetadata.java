package com.ai.flashcards.model;

import lombok.Builder;
import lombok.Value;

/**
 * Generation parameters stored alongside a cached flashcard set.
 */
@Value
@Builder
public class CacheMetadata {

    String subject;

    String difficulty;

    String focusAreas;

    /** Source text; only an excerpt of it is stored. */
    String sourceText;
}
