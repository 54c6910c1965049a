package com.ai.flashcards.service;

import com.ai.flashcards.dto.GenerationRequest;
import com.ai.flashcards.dto.JobStatusResponse;
import com.ai.flashcards.dto.JobSubmitResponse;
import com.ai.flashcards.dto.JobSummary;
import com.ai.flashcards.exception.ValidationException;
import com.ai.flashcards.export.FlashcardExporter;
import com.ai.flashcards.model.DocumentHandle;
import com.ai.flashcards.model.ExportFormat;
import com.ai.flashcards.model.Flashcard;
import com.ai.flashcards.model.Job;
import com.ai.flashcards.model.JobStatus;
import com.ai.flashcards.model.QualityTier;
import com.ai.flashcards.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * FlashcardJobService is the synchronous face of the job pipeline: it
 * validates submissions, enforces quota, creates the job record and hands it
 * to {@link JobProcessingService}. It also serves job snapshots and results.
 *
 * <p>
 * Quota is reserved by a guarded update just before the job record is
 * written and handed back if that write fails. Everything that goes wrong once
 * the job exists is reported through the job's {@code FAILED} state.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlashcardJobService {

    static final int MIN_CARDS = 1;
    static final int MAX_CARDS = 100;
    static final String BUSY_MESSAGE = "The server is busy. Please try again in a few minutes.";

    private final JobRepository jobRepository;
    private final QuotaService quotaService;
    private final SubscriptionStatusProvider subscriptionStatusProvider;
    private final JobProcessingService jobProcessingService;
    private final TempFileService tempFileService;
    private final JobJsonMapper jobJsonMapper;
    private final FlashcardExporter exporter;
    private final JobProgressPublisher progressPublisher;

    /**
     * Validates the request, reserves quota and queues the job.
     *
     * <p>
     * Ownership of {@code document}'s file passes to this service: it is
     * deleted here if the submission is rejected, otherwise by the job.
     * </p>
     *
     * @return the new job's id and initial status; processing has not necessarily started
     * @throws ValidationException     malformed parameters
     * @throws com.ai.flashcards.exception.QuotaExceededException upload allowance used up
     */
    public JobSubmitResponse submit(String userId, DocumentHandle document, GenerationRequest request) {
        return submit(userId, document, request, null);
    }

    /**
     * Starts a new job for a fresh upload of an earlier job's document, reusing
     * that job's generation parameters.
     */
    public JobSubmitResponse regenerate(String jobId, String userId, DocumentHandle document) {
        Job original;
        try {
            original = getOwnedJob(jobId, userId);
        } catch (RuntimeException e) {
            tempFileService.release(document.getPath());
            throw e;
        }

        GenerationRequest request = GenerationRequest.builder()
                .requestedCardCount(original.getRequestedCardCount())
                .subject(original.getSubject())
                .difficulty(original.getDifficulty())
                .focusAreas(new LinkedHashMap<>(jobJsonMapper.readFocusAreas(original.getFocusAreas())))
                .customContext(original.getCustomContext())
                .qualityTier(original.getQualityTier())
                .build();

        log.info("Regenerating job {} for user {}", jobId, userId);
        return submit(userId, document, request, original.getId());
    }

    public JobStatusResponse getStatus(String jobId, String userId) {
        Job job = getOwnedJob(jobId, userId);
        Integer cardCount = job.getFlashcards() == null
                ? null
                : jobJsonMapper.readFlashcards(job.getFlashcards()).size();
        return JobStatusResponse.from(job, cardCount, exportLinks(job));
    }

    /**
     * Opens one export artifact of a completed job.
     *
     * @throws ResponseStatusException 404 if the job has no artifact in that format
     */
    public Resource getExport(String jobId, String userId, ExportFormat format) {
        Job job = getOwnedJob(jobId, userId);
        Map<String, String> references = jobJsonMapper.readExportReferences(job.getExportReferences());
        String reference = references == null ? null : references.get(format.getKey());
        if (job.getStatus() != JobStatus.COMPLETED || reference == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND,
                    "No " + format.getKey() + " export available for job " + jobId);
        }
        try {
            return exporter.open(reference);
        } catch (IOException e) {
            log.warn("Export {} of job {} could not be opened: {}", format, jobId, e.getMessage());
            throw new ResponseStatusException(HttpStatus.NOT_FOUND,
                    "The " + format.getKey() + " export of job " + jobId + " is no longer available", e);
        }
    }

    /**
     * Cards of a job in generation order; empty until the job completes.
     */
    public List<Flashcard> getFlashcards(String jobId, String userId) {
        Job job = getOwnedJob(jobId, userId);
        return jobJsonMapper.readFlashcards(job.getFlashcards());
    }

    public List<JobSummary> getHistory(String userId) {
        return jobRepository.findByUserIdOrderByCreatedAtDesc(userId)
                .stream()
                .map(JobSummary::from)
                .collect(Collectors.toList());
    }

    /**
     * Loads a job and checks that {@code userId} owns it.
     *
     * @throws ResponseStatusException 404 if absent, 403 if owned by someone else
     */
    public Job getOwnedJob(String jobId, String userId) {
        Job job = jobRepository.findById(jobId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + jobId));
        if (!job.getUserId().equals(userId)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Access denied");
        }
        return job;
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private JobSubmitResponse submit(String userId, DocumentHandle document, GenerationRequest request,
            String regeneratedFromJobId) {
        Job job;
        try {
            validate(userId, request);
            int pages = quotaService.requireUpload(userId, document.getPageCount());
            quotaService.increment(userId, pages);
            job = createJob(userId, document, request, pages, regeneratedFromJobId);
        } catch (RuntimeException e) {
            tempFileService.release(document.getPath());
            throw e;
        }

        log.info("Job {} queued: user={}, file='{}', pages={}/{}, cards={}, tier={}",
                job.getId(), userId, job.getFileName(), job.getPagesProcessed(), job.getPageCount(),
                job.getRequestedCardCount(), job.getQualityTier().getValue());

        try {
            jobProcessingService.process(job.getId(), document.getPath());
        } catch (TaskRejectedException e) {
            log.warn("Job {} rejected by the job executor: {}", job.getId(), e.getMessage());
            rejectJob(job, document);
        }

        return JobSubmitResponse.builder()
                .jobId(job.getId())
                .status(job.getStatus())
                .pagesWillProcess(job.getPagesProcessed())
                .regeneratedFromJobId(regeneratedFromJobId)
                .build();
    }

    private Job createJob(String userId, DocumentHandle document, GenerationRequest request, int pages,
            String regeneratedFromJobId) {
        try {
            return jobRepository.save(Job.builder()
                    .id(UUID.randomUUID().toString())
                    .userId(userId)
                    .fileName(document.getFileName())
                    .fileSizeBytes(document.getSizeBytes())
                    .pageCount(document.getPageCount())
                    .pagesProcessed(pages)
                    .status(JobStatus.PENDING)
                    .progress(0)
                    .currentTask("Queued")
                    .subject(request.getSubject().trim())
                    .difficulty(request.getDifficulty())
                    .focusAreas(jobJsonMapper.writeFocusAreas(request.getFocusAreas()))
                    .customContext(request.getCustomContext())
                    .requestedCardCount(request.getRequestedCardCount())
                    .qualityTier(request.getQualityTier())
                    .regeneratedFromJobId(regeneratedFromJobId)
                    .build());
        } catch (RuntimeException e) {
            try {
                quotaService.refund(userId, pages);
            } catch (RuntimeException refundFailure) {
                e.addSuppressed(refundFailure);
            }
            throw e;
        }
    }

    /**
     * Fails a job that never reached the executor. The job did no work, so its
     * upload is handed back to the user's quota.
     */
    private void rejectJob(Job job, DocumentHandle document) {
        try {
            job.setStatus(JobStatus.FAILED);
            job.setErrorMessage(BUSY_MESSAGE);
            job.setCurrentTask("Failed");
            jobRepository.save(job);
            quotaService.refund(job.getUserId(), job.getPagesProcessed());
        } catch (RuntimeException e) {
            log.error("Job {} could not be marked failed after rejection: {}", job.getId(), e.getMessage(), e);
        } finally {
            tempFileService.release(document.getPath());
        }
        progressPublisher.failed(job.getId(), job.getProgress(), BUSY_MESSAGE);
    }

    private Map<String, String> exportLinks(Job job) {
        Map<String, String> references = jobJsonMapper.readExportReferences(job.getExportReferences());
        if (references == null) {
            return null;
        }
        Map<String, String> links = new LinkedHashMap<>();
        references.keySet().forEach(key -> links.put(key, "/api/jobs/" + job.getId() + "/exports/" + key));
        return links;
    }

    private void validate(String userId, GenerationRequest request) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("A user id is required.");
        }
        if (request == null) {
            throw new ValidationException("Generation parameters are required.");
        }
        int count = request.getRequestedCardCount();
        if (count < MIN_CARDS || count > MAX_CARDS) {
            throw new ValidationException(
                    "Card count must be between " + MIN_CARDS + " and " + MAX_CARDS + ". Received: " + count);
        }
        if (request.getSubject() == null || request.getSubject().isBlank()) {
            throw new ValidationException("Subject must not be empty.");
        }
        if (request.getDifficulty() == null) {
            throw new ValidationException("Difficulty must be one of beginner, intermediate, advanced.");
        }
        if (request.getQualityTier() == null) {
            throw new ValidationException("Quality tier must be one of basic, advanced.");
        }
        if (request.getQualityTier() == QualityTier.ADVANCED
                && !subscriptionStatusProvider.hasActiveSubscription(userId)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN,
                    "Advanced quality requires an active premium subscription.");
        }
    }
}
