package com.ai.flashcards.dto;

import com.ai.flashcards.model.Difficulty;
import com.ai.flashcards.model.Job;
import com.ai.flashcards.model.JobStatus;
import com.ai.flashcards.model.QualityTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Lightweight DTO for the job history list.
 * Excludes the flashcards themselves to keep the response payload small.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSummary {

    private String id;
    private String fileName;
    private JobStatus status;
    private int progress;
    private String subject;
    private Difficulty difficulty;
    private QualityTier qualityTier;
    private int requestedCardCount;
    private int pagesProcessed;
    private boolean fromCache;
    private String regeneratedFromJobId;
    private LocalDateTime createdAt;
    private LocalDateTime completedAt;

    /** Maps a Job entity to this lightweight DTO. */
    public static JobSummary from(Job job) {
        return JobSummary.builder()
                .id(job.getId())
                .fileName(job.getFileName())
                .status(job.getStatus())
                .progress(job.getProgress())
                .subject(job.getSubject())
                .difficulty(job.getDifficulty())
                .qualityTier(job.getQualityTier())
                .requestedCardCount(job.getRequestedCardCount())
                .pagesProcessed(job.getPagesProcessed())
                .fromCache(job.isFromCache())
                .regeneratedFromJobId(job.getRegeneratedFromJobId())
                .createdAt(job.getCreatedAt())
                .completedAt(job.getCompletedAt())
                .build();
    }
}
