package com.ai.flashcards.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A document-to-flashcard conversion request and its processing state.
 * Persisted to the `flashcard_jobs` table.
 *
 * <p>
 * While a job is running only the pipeline writes to it; everything else
 * reads snapshots.
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "flashcard_jobs", indexes = @Index(name = "idx_jobs_user", columnList = "userId"))
public class Job {

    @Id
    @Column(nullable = false, updatable = false, length = 36)
    private String id;

    @Column(nullable = false)
    private String userId;

    @Column(nullable = false)
    private String fileName;

    @Column
    private long fileSizeBytes;

    /** Pages in the uploaded document as reported by file analysis. */
    @Column
    private int pageCount;

    /** Pages actually fed to extraction after tier clamping. */
    @Column
    private int pagesProcessed;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    @Column(nullable = false)
    private int progress;

    @Column
    private String currentTask;

    @Column(nullable = false)
    private String subject;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Difficulty difficulty;

    /** Enabled focus areas as a JSON object of flag → boolean. */
    @Column(columnDefinition = "TEXT")
    private String focusAreas;

    @Column(columnDefinition = "TEXT")
    private String customContext;

    @Column(nullable = false)
    private int requestedCardCount;

    /** Generated flashcards serialized as a JSON array; null until populated. */
    @Column(columnDefinition = "TEXT")
    private String flashcards;

    /** Export format → artifact reference, serialized as JSON. */
    @Column(columnDefinition = "TEXT")
    private String exportReferences;

    @Column(length = 2000)
    private String errorMessage;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private QualityTier qualityTier;

    @Column(length = 36)
    private String regeneratedFromJobId;

    @Column
    private boolean fromCache;

    @Column
    private Long processingTimeMs;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column
    private LocalDateTime updatedAt;

    @Column
    private LocalDateTime completedAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null)
            createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
