package com.ai.flashcards.dto;

import com.ai.flashcards.model.JobStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response for POST /api/jobs and POST /api/jobs/{id}/regenerate.
 *
 * The job is already queued when this is returned; poll
 * {@code GET /api/jobs/{jobId}} or subscribe to {@code /topic/jobs/{jobId}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobSubmitResponse {

    private String jobId;

    private JobStatus status;

    /** Pages that will be read, after tier clamping. */
    private int pagesWillProcess;

    /** Set for regeneration jobs. */
    private String regeneratedFromJobId;
}
