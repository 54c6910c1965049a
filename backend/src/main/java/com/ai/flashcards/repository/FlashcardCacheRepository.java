package com.ai.flashcards.repository;

import com.ai.flashcards.model.CachedFlashcardSet;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Durable tier of the content cache, keyed by content hash.
 */
@Repository
public interface FlashcardCacheRepository extends JpaRepository<CachedFlashcardSet, String> {

    /**
     * Removes entries created before the given instant.
     */
    @Transactional
    long deleteByCreatedAtBefore(Instant cutoff);
}
