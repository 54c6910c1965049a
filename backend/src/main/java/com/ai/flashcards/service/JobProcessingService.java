package com.ai.flashcards.service;

import com.ai.flashcards.client.AiGenerationClient;
import com.ai.flashcards.client.FlashcardResponseParser;
import com.ai.flashcards.exception.ExtractionException;
import com.ai.flashcards.exception.GenerationException;
import com.ai.flashcards.export.FlashcardExporter;
import com.ai.flashcards.model.CacheMetadata;
import com.ai.flashcards.model.ExportFormat;
import com.ai.flashcards.model.ExtractionResult;
import com.ai.flashcards.model.Flashcard;
import com.ai.flashcards.model.Job;
import com.ai.flashcards.model.JobStatus;
import com.ai.flashcards.model.QualityTier;
import com.ai.flashcards.repository.JobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * JobProcessingService runs the generation pipeline of one job on the
 * {@code jobExecutor} pool.
 *
 * <pre>
 *  10  extracting text
 *  25  text extracted ─── cache hit ───────────────────────┐
 *  30  preprocessing                                       │
 *  35  chunked                                             │
 *  40  generating (per-chunk progress up to 75)            │
 *  75  generated, stored in cache                          │
 *                                                      80  loaded from cache
 *  90  exports written
 * 100  completed
 * </pre>
 *
 * Every checkpoint is saved and pushed to subscribers. Progress never moves
 * backwards, and any failure ends the job in {@code FAILED} with the progress
 * it had reached. The uploaded document and the job's scratch directory are
 * deleted on every exit path.
 */
@Slf4j
@Service
public class JobProcessingService {

    static final int EXCERPT_CHARS = 500;

    private final JobRepository jobRepository;
    private final DocumentExtractionService extractionService;
    private final ContentChunker contentChunker;
    private final ContentCacheService cacheService;
    private final FlashcardPromptBuilder promptBuilder;
    private final AiGenerationClient aiClient;
    private final FlashcardResponseParser responseParser;
    private final FlashcardExporter exporter;
    private final JobProgressPublisher progressPublisher;
    private final TempFileService tempFileService;
    private final JobJsonMapper jobJsonMapper;
    private final Clock clock;

    @Value("${flashcards.chunk.max-size:8000}")
    private int maxChunkSize = 8000;

    @Value("${llm.model.basic:gpt-4o-mini}")
    private String basicModel = "gpt-4o-mini";

    @Value("${llm.model.advanced:gpt-4o}")
    private String advancedModel = "gpt-4o";

    @Value("${llm.api.key:}")
    private String apiKey = "";

    @Value("${flashcards.export.formats:csv,json,quizlet}")
    private String exportFormats = "csv,json,quizlet";

    public JobProcessingService(JobRepository jobRepository,
            DocumentExtractionService extractionService,
            ContentChunker contentChunker,
            ContentCacheService cacheService,
            FlashcardPromptBuilder promptBuilder,
            AiGenerationClient aiClient,
            FlashcardResponseParser responseParser,
            FlashcardExporter exporter,
            JobProgressPublisher progressPublisher,
            TempFileService tempFileService,
            JobJsonMapper jobJsonMapper,
            Clock clock) {
        this.jobRepository = jobRepository;
        this.extractionService = extractionService;
        this.contentChunker = contentChunker;
        this.cacheService = cacheService;
        this.promptBuilder = promptBuilder;
        this.aiClient = aiClient;
        this.responseParser = responseParser;
        this.exporter = exporter;
        this.progressPublisher = progressPublisher;
        this.tempFileService = tempFileService;
        this.jobJsonMapper = jobJsonMapper;
        this.clock = clock;
    }

    /**
     * Processes a pending job to completion or failure. Never throws; the
     * outcome is recorded on the job.
     *
     * @param jobId    id of a job in {@code PENDING}
     * @param document spooled upload; deleted when this returns
     */
    @Async("jobExecutor")
    public void process(String jobId, Path document) {
        long startedAt = clock.millis();
        Job job = null;
        Path scratch = null;

        try {
            job = jobRepository.findById(jobId)
                    .orElseThrow(() -> new IllegalStateException("Job not found: " + jobId));
            log.info("Job {} starting: file='{}', pages={}", jobId, job.getFileName(), job.getPagesProcessed());

            // ── 1. Extract ───────────────────────────────────────────────────
            transition(job, JobStatus.PROCESSING);
            job = checkpoint(job, 10, "Extracting text from document");

            ExtractionResult extraction = extractionService.extract(document, job.getPagesProcessed());
            if (extraction.getText() == null || extraction.getText().isBlank()) {
                throw new ExtractionException(extraction.isScanned()
                        ? "No readable text found. The document appears to be scanned images only."
                        : "No readable text found in the document.");
            }
            scratch = tempFileService.createScratchDirectory(jobId);
            Files.writeString(scratch.resolve("extracted.txt"), extraction.getText(), StandardCharsets.UTF_8);
            job = checkpoint(job, 25, "Extracted text from " + job.getPagesProcessed() + " page(s)");

            // ── 2. Cache lookup ──────────────────────────────────────────────
            Map<String, Boolean> focusAreas = jobJsonMapper.readFocusAreas(job.getFocusAreas());
            String hash = cacheService.contentHash(extraction.getText(), job.getSubject(), job.getDifficulty(),
                    focusAreas);

            Optional<List<Flashcard>> cached = job.getRegeneratedFromJobId() == null
                    ? cacheService.get(hash)
                    : Optional.empty();

            List<Flashcard> flashcards;
            if (cached.isPresent()) {
                flashcards = cap(cached.get(), job.getRequestedCardCount());
                job.setFromCache(true);
                job.setFlashcards(jobJsonMapper.writeFlashcards(flashcards));
                job = checkpoint(job, 80, "Loaded " + flashcards.size() + " flashcards from cache");
                log.info("Job {} served from cache (hash={})", jobId, hash);
            } else {
                // ── 3. Preprocess and chunk ──────────────────────────────────
                job = checkpoint(job, 30, "Preprocessing content");
                String cleaned = contentChunker.preprocess(extraction.getText());
                List<String> chunks = contentChunker.chunk(cleaned, maxChunkSize);
                if (chunks.isEmpty()) {
                    throw new ExtractionException("The document does not contain enough text to create flashcards.");
                }
                job = checkpoint(job, 35, "Split content into " + chunks.size() + " section(s)");

                // ── 4. Generate ──────────────────────────────────────────────
                job = checkpoint(job, 40, "Generating flashcards");
                flashcards = generate(job, chunks, focusAreas);
                job.setFlashcards(jobJsonMapper.writeFlashcards(flashcards));

                cacheService.put(hash, flashcards, CacheMetadata.builder()
                        .subject(job.getSubject())
                        .difficulty(job.getDifficulty().getValue())
                        .focusAreas(ContentCacheService.canonicalFocusAreas(focusAreas))
                        .sourceText(extraction.getText())
                        .build());
                job = checkpoint(job, 75, "Generated " + flashcards.size() + " flashcards");
            }

            // ── 5. Export ────────────────────────────────────────────────────
            Map<String, String> references = new LinkedHashMap<>();
            for (ExportFormat format : configuredFormats()) {
                references.put(format.getKey(), exporter.produce(jobId, flashcards, format));
            }
            job.setExportReferences(jobJsonMapper.writeExportReferences(references));
            job = checkpoint(job, 90, "Export files ready");

            // ── 6. Complete ──────────────────────────────────────────────────
            transition(job, JobStatus.COMPLETED);
            job.setProgress(100);
            job.setCurrentTask("Completed");
            job.setCompletedAt(LocalDateTime.now(clock));
            job.setProcessingTimeMs(clock.millis() - startedAt);
            job = jobRepository.save(job);
            progressPublisher.completed(jobId, flashcards.size());

            log.info("Job {} completed: {} cards in {}ms (fromCache={}, memoryCacheSize={})",
                    jobId, flashcards.size(), job.getProcessingTimeMs(), job.isFromCache(), cacheService.memorySize());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(job, jobId, "Processing was interrupted.", e);
        } catch (Exception e) {
            fail(job, jobId, describe(e), e);
        } finally {
            tempFileService.release(document);
            tempFileService.release(scratch);
        }
    }

    /**
     * Generates cards chunk by chunk, stopping once enough cards exist. A
     * failure on the first chunk fails the job; later failures only skip that chunk.
     */
    List<Flashcard> generate(Job job, List<String> chunks, Map<String, Boolean> focusAreas)
            throws InterruptedException {
        int requested = job.getRequestedCardCount();
        int perChunk = ContentChunker.cardsPerChunk(requested, chunks.size());
        String model = job.getQualityTier() == QualityTier.ADVANCED ? advancedModel : basicModel;

        List<Flashcard> collected = new ArrayList<>();
        for (int i = 0; i < chunks.size() && collected.size() < requested; i++) {
            String prompt = promptBuilder.build(chunks.get(i), perChunk, job.getSubject(), job.getDifficulty(),
                    focusAreas, job.getCustomContext());
            try {
                String raw = aiClient.generate(prompt, model, apiKey);
                List<Flashcard> cards = responseParser.parse(raw, job.getSubject());
                collected.addAll(cards);
                log.info("Job {} chunk {}/{} produced {} card(s)", job.getId(), i + 1, chunks.size(), cards.size());
            } catch (GenerationException e) {
                if (i == 0) {
                    throw e;
                }
                log.warn("Job {} chunk {}/{} skipped after [{}] {}",
                        job.getId(), i + 1, chunks.size(), e.getType().getCode(), e.getMessage());
            }

            if (chunks.size() > 1 && i + 1 < chunks.size()) {
                int progress = 40 + (35 * (i + 1)) / chunks.size();
                checkpoint(job, progress, "Generated cards for section " + (i + 1) + " of " + chunks.size());
            }
        }
        return cap(collected, requested);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private Job checkpoint(Job job, int progress, String task) {
        job.setProgress(Math.max(job.getProgress(), progress));
        job.setCurrentTask(task);
        Job saved = jobRepository.save(job);
        progressPublisher.progress(saved.getId(), saved.getProgress(), task);
        log.debug("Job {} at {}%: {}", saved.getId(), saved.getProgress(), task);
        return saved;
    }

    private static void transition(Job job, JobStatus next) {
        if (!job.getStatus().canTransitionTo(next)) {
            throw new IllegalStateException("Job " + job.getId() + " cannot move from "
                    + job.getStatus() + " to " + next);
        }
        job.setStatus(next);
    }

    private void fail(Job job, String jobId, String message, Exception cause) {
        log.error("Job {} failed: {}", jobId, message, cause);
        if (job == null || job.getStatus().isTerminal()) {
            return;
        }
        try {
            transition(job, JobStatus.FAILED);
            job.setErrorMessage(truncate(message));
            job.setCurrentTask("Failed");
            jobRepository.save(job);
        } catch (RuntimeException e) {
            log.error("Job {} could not be marked failed: {}", jobId, e.getMessage(), e);
        }
        progressPublisher.failed(jobId, job.getProgress(), message);
    }

    private static String describe(Exception e) {
        if (e instanceof GenerationException) {
            GenerationException ge = (GenerationException) e;
            return "Flashcard generation failed (" + ge.getType().getCode() + "): " + ge.getMessage();
        }
        if (e instanceof IOException) {
            return e.getMessage() != null ? e.getMessage() : "The document could not be read.";
        }
        return "Unexpected error while processing the document.";
    }

    private List<ExportFormat> configuredFormats() {
        return Arrays.stream(exportFormats.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> ExportFormat.valueOf(s.toUpperCase(Locale.ROOT)))
                .collect(Collectors.toList());
    }

    private static List<Flashcard> cap(List<Flashcard> cards, int max) {
        return cards.size() <= max ? cards : new ArrayList<>(cards.subList(0, max));
    }

    private static String truncate(String message) {
        return message.length() <= 2000 ? message : message.substring(0, 2000);
    }
}
