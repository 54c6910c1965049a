package com.ai.flashcards.controller;

import com.ai.flashcards.dto.GenerationRequest;
import com.ai.flashcards.dto.JobStatusResponse;
import com.ai.flashcards.dto.JobSubmitResponse;
import com.ai.flashcards.dto.JobSummary;
import com.ai.flashcards.exception.ValidationException;
import com.ai.flashcards.model.Difficulty;
import com.ai.flashcards.model.DocumentHandle;
import com.ai.flashcards.model.ExportFormat;
import com.ai.flashcards.model.Flashcard;
import com.ai.flashcards.model.QualityTier;
import com.ai.flashcards.service.DocumentIntakeService;
import com.ai.flashcards.service.FlashcardJobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JobController exposes REST endpoints for submitting flashcard jobs and
 * reading their status, results and history.
 *
 * The caller is identified by the {@code X-User-Id} header set by the
 * authentication gateway in front of this service.
 */
@Slf4j
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
@CrossOrigin(origins = { "http://localhost:5173", "http://localhost:3000" })
public class JobController {

    static final String USER_HEADER = "X-User-Id";

    private final FlashcardJobService flashcardJobService;
    private final DocumentIntakeService documentIntakeService;

    // ── POST /api/jobs ────────────────────────────────────────────────────

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<JobSubmitResponse> submit(
            @RequestHeader(USER_HEADER) String userId,
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "cardCount", defaultValue = "20") int cardCount,
            @RequestParam("subject") String subject,
            @RequestParam(value = "difficulty", defaultValue = "intermediate") String difficulty,
            @RequestParam(value = "focusAreas", required = false) List<String> focusAreas,
            @RequestParam(value = "customContext", required = false) String customContext,
            @RequestParam(value = "qualityTier", defaultValue = "basic") String qualityTier) throws IOException {

        log.info("Received job submission: user={}, file='{}', size={}KB",
                userId, file.getOriginalFilename(), file.getSize() / 1024);

        GenerationRequest request = GenerationRequest.builder()
                .requestedCardCount(cardCount)
                .subject(subject)
                .difficulty(parseDifficulty(difficulty))
                .focusAreas(toFlags(focusAreas))
                .customContext(customContext)
                .qualityTier(parseQualityTier(qualityTier))
                .build();

        DocumentHandle document = documentIntakeService.accept(file);
        JobSubmitResponse response = flashcardJobService.submit(userId, document, request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    // ── GET /api/jobs/{id} ────────────────────────────────────────────────

    @GetMapping("/{id}")
    public ResponseEntity<JobStatusResponse> getStatus(
            @RequestHeader(USER_HEADER) String userId,
            @PathVariable String id) {
        return ResponseEntity.ok(flashcardJobService.getStatus(id, userId));
    }

    @GetMapping("/{id}/flashcards")
    public ResponseEntity<List<Flashcard>> getFlashcards(
            @RequestHeader(USER_HEADER) String userId,
            @PathVariable String id) {
        return ResponseEntity.ok(flashcardJobService.getFlashcards(id, userId));
    }

    // ── GET /api/jobs/{id}/exports/{format} ───────────────────────────────

    @GetMapping("/{id}/exports/{format}")
    public ResponseEntity<Resource> downloadExport(
            @RequestHeader(USER_HEADER) String userId,
            @PathVariable String id,
            @PathVariable String format) {
        ExportFormat exportFormat = parseExportFormat(format);
        Resource artifact = flashcardJobService.getExport(id, userId, exportFormat);

        log.info("Serving {} export of job {} to user {}", exportFormat.getKey(), id, userId);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(exportFormat.downloadName(id))
                        .build()
                        .toString())
                .contentType(MediaType.parseMediaType(exportFormat.getContentType()))
                .body(artifact);
    }

    @GetMapping
    public ResponseEntity<List<JobSummary>> getHistory(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(flashcardJobService.getHistory(userId));
    }

    // ── POST /api/jobs/{id}/regenerate ────────────────────────────────────

    /**
     * Starts a fresh generation for a re-uploaded document using the original
     * job's parameters. The cache is bypassed so new cards are produced.
     */
    @PostMapping(value = "/{id}/regenerate", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<JobSubmitResponse> regenerate(
            @RequestHeader(USER_HEADER) String userId,
            @PathVariable String id,
            @RequestParam("file") MultipartFile file) throws IOException {

        DocumentHandle document = documentIntakeService.accept(file);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(flashcardJobService.regenerate(id, userId, document));
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static Difficulty parseDifficulty(String raw) {
        return Difficulty.find(raw).orElseThrow(() -> new ValidationException(
                "Difficulty must be one of beginner, intermediate, advanced. Received: " + raw));
    }

    private static QualityTier parseQualityTier(String raw) {
        try {
            return QualityTier.fromValue(raw);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Quality tier must be one of basic, advanced. Received: " + raw);
        }
    }

    private static ExportFormat parseExportFormat(String raw) {
        return ExportFormat.fromKey(raw).orElseThrow(() -> new ValidationException(
                "Export format must be one of csv, json, quizlet. Received: " + raw));
    }

    private static Map<String, Boolean> toFlags(List<String> focusAreas) {
        Map<String, Boolean> flags = new LinkedHashMap<>();
        if (focusAreas != null) {
            focusAreas.stream()
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(s -> flags.put(s, Boolean.TRUE));
        }
        return flags;
    }
}
