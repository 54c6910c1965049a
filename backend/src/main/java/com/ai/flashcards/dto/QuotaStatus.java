package com.ai.flashcards.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Current monthly usage of a user, with any pending monthly reset applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QuotaStatus {

    private String userId;

    private int uploadsThisMonth;

    private int monthlyUploadLimit;

    private int pagesThisMonth;

    private int maxPagesPerFile;

    private Integer maxMonthlyPages;

    private boolean premium;

    /** True when stored counters belong to an earlier month and will restart on the next write. */
    private boolean needsReset;

    /** Uploads used as a percentage of the monthly limit (0-100). */
    private int percentageUsed;
}
