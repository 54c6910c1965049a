package com.ai.flashcards.service;

import com.ai.flashcards.model.DifficultyRating;
import com.ai.flashcards.model.StudyStatus;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Computes when a card should next be shown.
 *
 * <p>
 * Cards that have not graduated ({@code new}) come back after 10 minutes,
 * 1 hour, then 4 hours. Graduated cards use a base interval by status and
 * rating, grown by the rating's ease factor:
 * </p>
 *
 * <pre>
 *              easy   medium   hard
 * known         7d      4d      2d
 * reviewing     3d      1d     0.5d
 *
 * reviewCount 0  → base
 * reviewCount 1  → base × 1.5
 * reviewCount n  → round(base × ease^(n-1))
 * </pre>
 *
 * Known cards are capped at 180 days. Intervals are applied at hour
 * resolution, so reviewing cards under a day come back after the matching
 * number of hours.
 */
@Component
public class SpacedRepetitionScheduler {

    static final double MAX_KNOWN_INTERVAL_DAYS = 180;

    private static final Duration[] NEW_CARD_STEPS = {
            Duration.ofMinutes(10),
            Duration.ofHours(1),
            Duration.ofHours(4)
    };

    public Instant nextReview(StudyStatus status, DifficultyRating rating, int reviewCount, Instant now) {
        DifficultyRating effectiveRating = rating != null ? rating : DifficultyRating.MEDIUM;
        int count = Math.max(0, reviewCount);

        if (status == null || status == StudyStatus.NEW) {
            return now.plus(NEW_CARD_STEPS[Math.min(count, NEW_CARD_STEPS.length - 1)]);
        }

        double days = intervalDays(status, effectiveRating, count);
        if (status == StudyStatus.KNOWN) {
            days = Math.min(days, MAX_KNOWN_INTERVAL_DAYS);
        }
        long hours = Math.max(1, Math.round(days * 24));
        return now.plus(Duration.ofHours(hours));
    }

    static double intervalDays(StudyStatus status, DifficultyRating rating, int reviewCount) {
        double base = baseIntervalDays(status, rating);
        if (reviewCount == 0) {
            return base;
        }
        if (reviewCount == 1) {
            return base * 1.5;
        }
        return Math.round(base * Math.pow(rating.getEaseFactor(), reviewCount - 1));
    }

    private static double baseIntervalDays(StudyStatus status, DifficultyRating rating) {
        if (status == StudyStatus.KNOWN) {
            return switch (rating) {
                case EASY -> 7;
                case MEDIUM -> 4;
                case HARD -> 2;
            };
        }
        return switch (rating) {
            case EASY -> 3;
            case MEDIUM -> 1;
            case HARD -> 0.5;
        };
    }
}
