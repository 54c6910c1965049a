package com.ai.flashcards.dto;

import com.ai.flashcards.model.Difficulty;
import com.ai.flashcards.model.QualityTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generation parameters of a job submission.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationRequest {

    private int requestedCardCount;

    private String subject;

    private Difficulty difficulty;

    /** Focus-area flag name → enabled. */
    @Builder.Default
    private Map<String, Boolean> focusAreas = new LinkedHashMap<>();

    /** Free-form extra instructions; optional. */
    private String customContext;

    private QualityTier qualityTier;
}
