package com.ai.flashcards.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of POST /api/study/{jobId}/cards/{cardIndex}/review.
 * {@code status} is new | reviewing | known; {@code rating} is easy | medium | hard.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReviewRequest {
    @NotBlank(message = "status is required")
    private String status;
    private String rating;
}
