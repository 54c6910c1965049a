package com.ai.flashcards.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * WebSocket message DTO sent to /topic/jobs/{jobId}.
 *
 * <pre>
 * ┌──────────────────┬──────────────────────────────────────────┐
 * │ type             │ Payload fields                           │
 * ├──────────────────┼──────────────────────────────────────────┤
 * │ JOB_PROGRESS     │ progress, currentTask                    │
 * │ JOB_COMPLETED    │ progress (100), currentTask, cardCount   │
 * │ JOB_FAILED       │ progress (last reached), error           │
 * └──────────────────┴──────────────────────────────────────────┘
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL) // omit null fields from JSON
public class JobProgressMessage {

    public static final String PROGRESS = "JOB_PROGRESS";
    public static final String COMPLETED = "JOB_COMPLETED";
    public static final String FAILED = "JOB_FAILED";

    private String type;

    private String jobId;

    private Integer progress;

    private String currentTask;

    private Integer cardCount;

    private String error;

    // ── Static factory methods ───────────────────────────────────────────

    public static JobProgressMessage progress(String jobId, int progress, String currentTask) {
        return JobProgressMessage.builder()
                .type(PROGRESS)
                .jobId(jobId)
                .progress(progress)
                .currentTask(currentTask)
                .build();
    }

    public static JobProgressMessage completed(String jobId, int cardCount) {
        return JobProgressMessage.builder()
                .type(COMPLETED)
                .jobId(jobId)
                .progress(100)
                .currentTask("Completed")
                .cardCount(cardCount)
                .build();
    }

    public static JobProgressMessage failed(String jobId, int progress, String error) {
        return JobProgressMessage.builder()
                .type(FAILED)
                .jobId(jobId)
                .progress(progress)
                .error(error)
                .build();
    }
}
