package com.ai.flashcards.dto;

import com.ai.flashcards.model.Job;
import com.ai.flashcards.model.JobStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Snapshot of a job for GET /api/jobs/{id}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {

    private String jobId;
    private JobStatus status;
    private int progress;
    private String currentTask;
    private String errorMessage;

    private String fileName;
    private int pageCount;
    private int pagesProcessed;
    private Integer cardCount;
    private boolean fromCache;
    private Long processingTimeMs;
    private String regeneratedFromJobId;

    /** Export format key → download URL; present once completed. */
    private Map<String, String> exports;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime completedAt;

    public static JobStatusResponse from(Job job, Integer cardCount, Map<String, String> exports) {
        return JobStatusResponse.builder()
                .jobId(job.getId())
                .status(job.getStatus())
                .progress(job.getProgress())
                .currentTask(job.getCurrentTask())
                .errorMessage(job.getErrorMessage())
                .fileName(job.getFileName())
                .pageCount(job.getPageCount())
                .pagesProcessed(job.getPagesProcessed())
                .cardCount(cardCount)
                .fromCache(job.isFromCache())
                .processingTimeMs(job.getProcessingTimeMs())
                .regeneratedFromJobId(job.getRegeneratedFromJobId())
                .exports(exports)
                .createdAt(job.getCreatedAt())
                .updatedAt(job.getUpdatedAt())
                .completedAt(job.getCompletedAt())
                .build();
    }
}
