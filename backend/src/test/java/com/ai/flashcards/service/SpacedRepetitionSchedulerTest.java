package com.ai.flashcards.service;

import com.ai.flashcards.model.DifficultyRating;
import com.ai.flashcards.model.StudyStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SpacedRepetitionSchedulerTest {

    private static final Instant NOW = Instant.parse("2025-03-10T09:00:00Z");

    private final SpacedRepetitionScheduler scheduler = new SpacedRepetitionScheduler();

    private Duration interval(StudyStatus status, DifficultyRating rating, int reviewCount) {
        return Duration.between(NOW, scheduler.nextReview(status, rating, reviewCount, NOW));
    }

    @Nested
    @DisplayName("known cards")
    class Known {

        @Test
        void shouldUseBaseIntervalOnFirstReview() {
            assertThat(interval(StudyStatus.KNOWN, DifficultyRating.EASY, 0)).isEqualTo(Duration.ofDays(7));
            assertThat(interval(StudyStatus.KNOWN, DifficultyRating.MEDIUM, 0)).isEqualTo(Duration.ofDays(4));
            assertThat(interval(StudyStatus.KNOWN, DifficultyRating.HARD, 0)).isEqualTo(Duration.ofDays(2));
        }

        @Test
        void shouldGrowByHalfOnSecondReview() {
            assertThat(interval(StudyStatus.KNOWN, DifficultyRating.EASY, 1)).isEqualTo(Duration.ofHours(252));
        }

        @Test
        void shouldApplyEaseFactorFromThirdReview() {
            // round(7 × 2.8) = 20
            assertThat(interval(StudyStatus.KNOWN, DifficultyRating.EASY, 2)).isEqualTo(Duration.ofDays(20));
        }

        @Test
        void shouldCapAt180Days() {
            assertThat(interval(StudyStatus.KNOWN, DifficultyRating.HARD, 10)).isEqualTo(Duration.ofDays(180));
            assertThat(interval(StudyStatus.KNOWN, DifficultyRating.EASY, 25)).isEqualTo(Duration.ofDays(180));
        }

        @Test
        void shouldDefaultToMediumWhenRatingMissing() {
            assertThat(interval(StudyStatus.KNOWN, null, 0)).isEqualTo(Duration.ofDays(4));
        }
    }

    @Nested
    @DisplayName("reviewing cards")
    class Reviewing {

        @Test
        void shouldExpressSubDayIntervalInHours() {
            assertThat(interval(StudyStatus.REVIEWING, DifficultyRating.HARD, 0)).isEqualTo(Duration.ofHours(12));
        }

        @Test
        void shouldRoundEaseGrowthToWholeDays() {
            // round(1 × 2.5) = 3
            assertThat(interval(StudyStatus.REVIEWING, DifficultyRating.MEDIUM, 2)).isEqualTo(Duration.ofDays(3));
        }

        @Test
        void shouldNotCapReviewingCards() {
            // round(3 × 2.8^6) = 1446
            assertThat(interval(StudyStatus.REVIEWING, DifficultyRating.EASY, 7)).isEqualTo(Duration.ofDays(1446));
        }
    }

    @Nested
    @DisplayName("new cards")
    class NewCards {

        @Test
        void shouldUseShortEscalatingSteps() {
            assertThat(interval(StudyStatus.NEW, DifficultyRating.EASY, 0)).isEqualTo(Duration.ofMinutes(10));
            assertThat(interval(StudyStatus.NEW, DifficultyRating.HARD, 1)).isEqualTo(Duration.ofHours(1));
            assertThat(interval(StudyStatus.NEW, DifficultyRating.MEDIUM, 2)).isEqualTo(Duration.ofHours(4));
            assertThat(interval(StudyStatus.NEW, DifficultyRating.MEDIUM, 9)).isEqualTo(Duration.ofHours(4));
        }

        @Test
        void shouldTreatUnknownStatusAsNew() {
            StudyStatus unknown = StudyStatus.fromValue("unknown");

            assertThat(interval(unknown, null, 0)).isEqualTo(Duration.ofMinutes(10));
        }
    }

    @Test
    void shouldNeverScheduleBeforeNow() {
        for (StudyStatus status : StudyStatus.values()) {
            for (DifficultyRating rating : DifficultyRating.values()) {
                for (int count = 0; count < 12; count++) {
                    assertThat(scheduler.nextReview(status, rating, count, NOW)).isAfter(NOW);
                }
            }
        }
    }
}
