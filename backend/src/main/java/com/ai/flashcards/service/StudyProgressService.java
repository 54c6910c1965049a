package com.ai.flashcards.service;

import com.ai.flashcards.model.DifficultyRating;
import com.ai.flashcards.model.Job;
import com.ai.flashcards.model.JobStatus;
import com.ai.flashcards.model.StudyProgress;
import com.ai.flashcards.model.StudyStatus;
import com.ai.flashcards.repository.StudyProgressRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * StudyProgressService records review events and schedules each card's next review.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StudyProgressService {

    private final StudyProgressRepository studyProgressRepository;
    private final FlashcardJobService flashcardJobService;
    private final SpacedRepetitionScheduler scheduler;
    private final Clock clock;

    /**
     * Applies one review of a card: creates the progress record on the first
     * review, updates it afterwards, and sets the next review time from the
     * number of reviews seen before this one.
     */
    public StudyProgress recordReview(String userId, String jobId, int cardIndex,
            StudyStatus status, DifficultyRating rating) {

        Job job = flashcardJobService.getOwnedJob(jobId, userId);
        if (job.getStatus() != JobStatus.COMPLETED) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Job " + jobId + " has no flashcards yet");
        }
        int cardCount = flashcardJobService.getFlashcards(jobId, userId).size();
        if (cardIndex < 0 || cardIndex >= cardCount) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND,
                    "Card " + cardIndex + " does not exist in job " + jobId);
        }

        Instant now = clock.instant();
        DifficultyRating effectiveRating = rating != null ? rating : DifficultyRating.MEDIUM;
        StudyProgress progress = studyProgressRepository
                .findByUserIdAndJobIdAndCardIndex(userId, jobId, cardIndex)
                .orElseGet(() -> StudyProgress.builder()
                        .userId(userId)
                        .jobId(jobId)
                        .cardIndex(cardIndex)
                        .reviewCount(0)
                        .build());
        boolean firstReview = progress.getId() == null;
        applyReview(progress, status, effectiveRating, now);

        StudyProgress saved;
        try {
            saved = studyProgressRepository.save(progress);
        } catch (DataIntegrityViolationException e) {
            if (!firstReview) {
                throw e;
            }
            // Another first review of this card was stored in the meantime.
            log.debug("Concurrent first review of card {} in job {}; applying as update", cardIndex, jobId);
            StudyProgress existing = studyProgressRepository
                    .findByUserIdAndJobIdAndCardIndex(userId, jobId, cardIndex)
                    .orElseThrow(() -> e);
            applyReview(existing, status, effectiveRating, now);
            saved = studyProgressRepository.save(existing);
        }
        log.debug("Review recorded: user={}, job={}, card={}, status={}, next={}",
                userId, jobId, cardIndex, status, saved.getNextReviewAt());
        return saved;
    }

    public List<StudyProgress> getProgress(String userId, String jobId) {
        flashcardJobService.getOwnedJob(jobId, userId);
        return studyProgressRepository.findByUserIdAndJobIdOrderByCardIndexAsc(userId, jobId);
    }

    /**
     * Cards of a job due for review now.
     */
    public List<StudyProgress> getDueCards(String userId, String jobId) {
        flashcardJobService.getOwnedJob(jobId, userId);
        return studyProgressRepository
                .findByUserIdAndJobIdAndNextReviewAtLessThanEqualOrderByNextReviewAtAsc(userId, jobId, clock.instant());
    }

    private void applyReview(StudyProgress progress, StudyStatus status, DifficultyRating rating, Instant now) {
        Instant next = scheduler.nextReview(status, rating, progress.getReviewCount(), now);
        progress.setStatus(status);
        progress.setDifficultyRating(rating);
        progress.setLastReviewedAt(now);
        progress.setNextReviewAt(next);
        progress.setReviewCount(progress.getReviewCount() + 1);
    }
}
