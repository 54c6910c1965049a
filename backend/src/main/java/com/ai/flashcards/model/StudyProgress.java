package com.ai.flashcards.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Review state of one card of one job for one user. Created on the first
 * review and updated on every later one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "study_progress",
        uniqueConstraints = @UniqueConstraint(name = "uk_study_progress_card",
                columnNames = { "userId", "jobId", "cardIndex" }),
        indexes = @Index(name = "idx_study_progress_next_review", columnList = "nextReviewAt"))
public class StudyProgress {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String userId;

    @Column(nullable = false, length = 36)
    private String jobId;

    @Column(nullable = false)
    private int cardIndex;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private StudyStatus status;

    @Column(nullable = false)
    private int reviewCount;

    @Column(nullable = false)
    private Instant lastReviewedAt;

    @Column(nullable = false)
    private Instant nextReviewAt;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private DifficultyRating difficultyRating;
}
