package com.ai.flashcards.repository;

import com.ai.flashcards.model.StudyProgress;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for per-card review state.
 */
@Repository
public interface StudyProgressRepository extends JpaRepository<StudyProgress, Long> {

    Optional<StudyProgress> findByUserIdAndJobIdAndCardIndex(String userId, String jobId, int cardIndex);

    List<StudyProgress> findByUserIdAndJobIdOrderByCardIndexAsc(String userId, String jobId);

    /**
     * Cards of a job whose next review is due at or before {@code now}, soonest first.
     */
    List<StudyProgress> findByUserIdAndJobIdAndNextReviewAtLessThanEqualOrderByNextReviewAtAsc(
            String userId, String jobId, Instant now);
}
