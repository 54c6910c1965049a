package com.ai.flashcards.controller;

import com.ai.flashcards.dto.QuotaStatus;
import com.ai.flashcards.dto.UploadDecision;
import com.ai.flashcards.exception.ValidationException;
import com.ai.flashcards.service.QuotaService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Usage and upload pre-checks for the calling user.
 */
@RestController
@RequestMapping("/api/quota")
@RequiredArgsConstructor
@CrossOrigin(origins = { "http://localhost:5173", "http://localhost:3000" })
public class QuotaController {

    private final QuotaService quotaService;

    @GetMapping
    public ResponseEntity<QuotaStatus> getQuota(@RequestHeader(JobController.USER_HEADER) String userId) {
        return ResponseEntity.ok(quotaService.getQuota(userId));
    }

    @GetMapping("/check")
    public ResponseEntity<UploadDecision> check(
            @RequestHeader(JobController.USER_HEADER) String userId,
            @RequestParam("pages") int pages) {
        if (pages < 1) {
            throw new ValidationException("pages must be at least 1");
        }
        return ResponseEntity.ok(quotaService.canUpload(userId, pages));
    }

    /**
     * Called by the billing integration when a subscription starts or ends.
     */
    @PutMapping("/tier")
    public ResponseEntity<QuotaStatus> updateTier(
            @RequestHeader(JobController.USER_HEADER) String userId,
            @RequestParam("premium") boolean premium) {
        quotaService.updateTier(userId, premium);
        return ResponseEntity.ok(quotaService.getQuota(userId));
    }
}
