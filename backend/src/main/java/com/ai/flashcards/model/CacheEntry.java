package com.ai.flashcards.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Memory-tier cache entry. Entries are replaced or evicted, never modified.
 */
@Value
@Builder
public class CacheEntry {

    String contentHash;

    List<Flashcard> flashcards;

    String subject;

    String difficulty;

    String focusAreas;

    Instant createdAt;

    String sourceExcerpt;
}
