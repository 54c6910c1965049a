package com.ai.flashcards.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Durable-tier cache entry: the flashcards produced for one content hash
 * together with the generation parameters that produced them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "flashcard_cache")
public class CachedFlashcardSet {

    @Id
    @Column(length = 32, nullable = false, updatable = false)
    private String contentHash;

    /** Flashcards serialized as a JSON array. */
    @Column(columnDefinition = "TEXT", nullable = false)
    private String flashcards;

    @Column
    private String subject;

    @Column(length = 16)
    private String difficulty;

    @Column(columnDefinition = "TEXT")
    private String focusAreas;

    /** First 1000 characters of the source text, kept for diagnostics only. */
    @Column(columnDefinition = "TEXT")
    private String sourceExcerpt;

    @Column(nullable = false)
    private Instant createdAt;
}
