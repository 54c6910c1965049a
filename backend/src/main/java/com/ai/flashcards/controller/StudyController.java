package com.ai.flashcards.controller;

import com.ai.flashcards.dto.ReviewRequest;
import com.ai.flashcards.exception.ValidationException;
import com.ai.flashcards.model.DifficultyRating;
import com.ai.flashcards.model.StudyProgress;
import com.ai.flashcards.model.StudyStatus;
import com.ai.flashcards.service.StudyProgressService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * StudyController records review outcomes and lists cards due for review.
 */
@RestController
@RequestMapping("/api/study")
@RequiredArgsConstructor
@CrossOrigin(origins = { "http://localhost:5173", "http://localhost:3000" })
public class StudyController {

    private final StudyProgressService studyProgressService;

    @PostMapping("/{jobId}/cards/{cardIndex}/review")
    public ResponseEntity<StudyProgress> review(
            @RequestHeader(JobController.USER_HEADER) String userId,
            @PathVariable String jobId,
            @PathVariable int cardIndex,
            @Valid @RequestBody ReviewRequest request) {

        StudyProgress progress = studyProgressService.recordReview(userId, jobId, cardIndex,
                parseStatus(request.getStatus()),
                DifficultyRating.fromValue(request.getRating()));
        return ResponseEntity.ok(progress);
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<List<StudyProgress>> progress(
            @RequestHeader(JobController.USER_HEADER) String userId,
            @PathVariable String jobId) {
        return ResponseEntity.ok(studyProgressService.getProgress(userId, jobId));
    }

    @GetMapping("/{jobId}/due")
    public ResponseEntity<List<StudyProgress>> due(
            @RequestHeader(JobController.USER_HEADER) String userId,
            @PathVariable String jobId) {
        return ResponseEntity.ok(studyProgressService.getDueCards(userId, jobId));
    }

    private static StudyStatus parseStatus(String raw) {
        try {
            return StudyStatus.fromValue(raw);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Status must be one of new, reviewing, known. Received: " + raw);
        }
    }
}
