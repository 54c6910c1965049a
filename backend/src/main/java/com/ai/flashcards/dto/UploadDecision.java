package com.ai.flashcards.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Result of checking whether a user may upload a document of a given size.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UploadDecision {

    private boolean allowed;

    /** Human-readable explanation; present only when denied. */
    private String reason;

    /** Pages that will actually be processed after tier and budget clamping. */
    private int pagesWillProcess;

    /** Present only when denied. */
    private LocalDate nextResetDate;

    private Long daysUntilReset;

    /** True when a higher tier would lift the limit that was hit. */
    private Boolean upgradeAvailable;
}
