package com.ai.flashcards.service;

import com.ai.flashcards.MutableClock;
import com.ai.flashcards.client.AiGenerationClient;
import com.ai.flashcards.client.FlashcardResponseParser;
import com.ai.flashcards.exception.ExtractionException;
import com.ai.flashcards.exception.GenerationErrorType;
import com.ai.flashcards.exception.GenerationException;
import com.ai.flashcards.export.FlashcardExporter;
import com.ai.flashcards.model.CachedFlashcardSet;
import com.ai.flashcards.model.Difficulty;
import com.ai.flashcards.model.ExportFormat;
import com.ai.flashcards.model.ExtractionResult;
import com.ai.flashcards.model.Flashcard;
import com.ai.flashcards.model.Job;
import com.ai.flashcards.model.JobStatus;
import com.ai.flashcards.model.QualityTier;
import com.ai.flashcards.repository.FlashcardCacheRepository;
import com.ai.flashcards.repository.JobRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobProcessingServiceTest {

    private static final String JOB_ID = "job-1";
    private static final String TEXT = "Cells are the basic structural unit of all living organisms. "
            + "The nucleus stores genetic information in the form of DNA.";
    private static final String AI_RESPONSE = """
            {"flashcards":[
              {"question":"What is the basic unit of life?","answer":"The cell","topic":"Cells"},
              {"question":"Where is DNA stored?","answer":"In the nucleus","topic":"Cells"},
              {"question":"What does DNA carry?","answer":"Genetic information","topic":"Genetics"}
            ]}
            """;

    @Mock
    private JobRepository jobRepository;
    @Mock
    private DocumentExtractionService extractionService;
    @Mock
    private FlashcardCacheRepository cacheRepository;
    @Mock
    private AiGenerationClient aiClient;
    @Mock
    private FlashcardExporter exporter;
    @Mock
    private JobProgressPublisher publisher;

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final MutableClock clock = new MutableClock(Instant.parse("2025-06-02T08:00:00Z"));

    private ContentCacheService cacheService;
    private TempFileService tempFileService;
    private JobProcessingService service;
    private Job job;
    private Path document;

    @BeforeEach
    void setUp() throws Exception {
        cacheService = new ContentCacheService(cacheRepository, objectMapper, clock, 24, 7, 60, 100, 80, 150);
        tempFileService = new TempFileService(tempDir.toString(), 60, clock);
        service = new JobProcessingService(jobRepository, extractionService, new ContentChunker(50), cacheService,
                new FlashcardPromptBuilder(), aiClient, new FlashcardResponseParser(objectMapper), exporter,
                publisher, tempFileService, new JobJsonMapper(objectMapper), clock);

        job = Job.builder()
                .id(JOB_ID)
                .userId("u1")
                .fileName("cells.pdf")
                .pageCount(5)
                .pagesProcessed(5)
                .status(JobStatus.PENDING)
                .subject("Biology")
                .difficulty(Difficulty.BEGINNER)
                .focusAreas("{\"definitions\":true}")
                .requestedCardCount(2)
                .qualityTier(QualityTier.BASIC)
                .build();

        document = Files.writeString(tempDir.resolve("upload-test.pdf"), "%PDF-1.4 fake");

        lenient().when(jobRepository.findById(JOB_ID)).thenReturn(Optional.of(job));
        lenient().when(jobRepository.save(any(Job.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(exporter.produce(eq(JOB_ID), any(), any(ExportFormat.class)))
                .thenAnswer(inv -> "/exports/" + JOB_ID + "/" + ((ExportFormat) inv.getArgument(2)).getFileName());
    }

    private void givenExtractedText(String text) throws Exception {
        when(extractionService.extract(document, 5)).thenReturn(ExtractionResult.builder()
                .text(text).pageCount(5).scanned(false).confidence(0.95).build());
    }

    private List<Integer> publishedProgress() {
        ArgumentCaptor<Integer> progress = ArgumentCaptor.forClass(Integer.class);
        verify(publisher, atLeastOnce()).progress(eq(JOB_ID), progress.capture(), anyString());
        return progress.getAllValues();
    }

    @Test
    @DisplayName("a one-hour-old cache entry completes the job without generation stages")
    void shouldCompleteFromCacheWithoutGenerationEvents() throws Exception {
        // GIVEN a durable cache row written an hour ago for this exact content
        givenExtractedText(TEXT);
        String hash = cacheService.contentHash(TEXT, "Biology", Difficulty.BEGINNER, Map.of("definitions", true));
        List<Flashcard> cached = List.of(
                Flashcard.builder().front("Cached Q").back("Cached A").subject("Biology")
                        .difficulty(Difficulty.BEGINNER).tags(List.of("Biology")).build());
        when(cacheRepository.findById(hash)).thenReturn(Optional.of(CachedFlashcardSet.builder()
                .contentHash(hash)
                .flashcards(objectMapper.writeValueAsString(cached))
                .createdAt(clock.instant().minus(Duration.ofHours(1)))
                .build()));

        // WHEN
        service.process(JOB_ID, document);

        // THEN
        assertThat(publishedProgress()).containsExactly(10, 25, 80, 90)
                .doesNotContain(30, 35, 40, 75);
        verifyNoInteractions(aiClient);
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getProgress()).isEqualTo(100);
        assertThat(job.isFromCache()).isTrue();
        assertThat(job.getFlashcards()).contains("Cached Q");
        assertThat(job.getProcessingTimeMs()).isNotNull();
        verify(publisher).completed(JOB_ID, 1);
    }

    @Test
    void shouldGenerateCapAndCacheOnMiss() throws Exception {
        givenExtractedText(TEXT);
        when(cacheRepository.findById(anyString())).thenReturn(Optional.empty());
        when(aiClient.generate(anyString(), eq("gpt-4o-mini"), anyString())).thenReturn(AI_RESPONSE);

        service.process(JOB_ID, document);

        assertThat(publishedProgress()).containsExactly(10, 25, 30, 35, 40, 75, 90);
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.isFromCache()).isFalse();

        List<Flashcard> stored = new JobJsonMapper(objectMapper).readFlashcards(job.getFlashcards());
        assertThat(stored).extracting(Flashcard::getFront)
                .containsExactly("What is the basic unit of life?", "Where is DNA stored?");
        assertThat(job.getExportReferences()).contains("csv", "json", "quizlet");
        verify(exporter, times(3)).produce(eq(JOB_ID), any(), any(ExportFormat.class));
        verify(cacheRepository).save(any(CachedFlashcardSet.class));
        assertThat(cacheService.memorySize()).isEqualTo(1);
    }

    @Test
    void shouldUseAdvancedModelForAdvancedTier() throws Exception {
        job.setQualityTier(QualityTier.ADVANCED);
        givenExtractedText(TEXT);
        when(cacheRepository.findById(anyString())).thenReturn(Optional.empty());
        when(aiClient.generate(anyString(), eq("gpt-4o"), anyString())).thenReturn(AI_RESPONSE);

        service.process(JOB_ID, document);

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void shouldFailJobWhenFirstChunkFails() throws Exception {
        givenExtractedText(TEXT);
        when(cacheRepository.findById(anyString())).thenReturn(Optional.empty());
        when(aiClient.generate(anyString(), anyString(), anyString()))
                .thenThrow(new GenerationException(GenerationErrorType.RATE_LIMIT, "Too many requests"));

        service.process(JOB_ID, document);

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorMessage()).contains("rate_limit").contains("Too many requests");
        assertThat(job.getProgress()).isEqualTo(40);
        verify(publisher).failed(eq(JOB_ID), eq(40), anyString());
        verify(publisher, never()).completed(anyString(), anyInt());
        verify(cacheRepository, never()).save(any());
        verifyNoInteractions(exporter);
    }

    @Test
    void shouldKeepFirstChunkCardsWhenLaterChunksFail() throws Exception {
        // GIVEN four sentences that each become their own chunk
        ReflectionTestUtils.setField(service, "maxChunkSize", 120);
        job.setRequestedCardCount(4);
        String text = "Mitosis is the process by which a single cell divides into two identical cells. "
                + "Meiosis produces four genetically distinct gametes from one parent cell overall. "
                + "Chromosomes condense during prophase so they become visible under a microscope. "
                + "Cytokinesis splits the cytoplasm after the nucleus has finished dividing in two.";
        givenExtractedText(text);
        when(cacheRepository.findById(anyString())).thenReturn(Optional.empty());
        when(aiClient.generate(anyString(), anyString(), anyString()))
                .thenReturn("[{\"question\":\"What is mitosis?\",\"answer\":\"Cell division\"}]")
                .thenThrow(new GenerationException(GenerationErrorType.SERVER_ERROR, "Bad gateway"));

        // WHEN
        service.process(JOB_ID, document);

        // THEN
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(new JobJsonMapper(objectMapper).readFlashcards(job.getFlashcards()))
                .extracting(Flashcard::getFront).containsExactly("What is mitosis?");
        verify(aiClient, times(4)).generate(anyString(), anyString(), anyString());
        assertThat(publishedProgress()).isSorted().contains(40, 75);
    }

    @Test
    void shouldSkipCacheLookupForRegeneration() throws Exception {
        job.setRegeneratedFromJobId("job-0");
        givenExtractedText(TEXT);
        when(aiClient.generate(anyString(), anyString(), anyString())).thenReturn(AI_RESPONSE);

        service.process(JOB_ID, document);

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        verify(cacheRepository, never()).findById(anyString());
        verify(cacheRepository).save(any(CachedFlashcardSet.class));
    }

    @Test
    void shouldFailWithReadableMessageWhenExtractionFails() throws Exception {
        when(extractionService.extract(document, 5))
                .thenThrow(new ExtractionException("Text extraction timed out after 180 seconds."));

        service.process(JOB_ID, document);

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorMessage()).isEqualTo("Text extraction timed out after 180 seconds.");
        assertThat(job.getProgress()).isEqualTo(10);
        verifyNoInteractions(aiClient, cacheRepository);
    }

    @Test
    void shouldFailWhenDocumentHasNoText() throws Exception {
        when(extractionService.extract(document, 5)).thenReturn(ExtractionResult.builder()
                .text("").pageCount(5).scanned(true).confidence(0.0).build());

        service.process(JOB_ID, document);

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorMessage()).contains("scanned");
    }

    @Test
    void shouldReleaseDocumentAndScratchDirectoryOnEveryExitPath() throws Exception {
        givenExtractedText(TEXT);
        when(cacheRepository.findById(anyString())).thenReturn(Optional.empty());
        when(aiClient.generate(anyString(), anyString(), anyString()))
                .thenThrow(new GenerationException(GenerationErrorType.INVALID_RESPONSE, "garbage"));

        service.process(JOB_ID, document);

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(document).doesNotExist();
        assertThat(tempDir.resolve("job-" + JOB_ID)).doesNotExist();
    }

    @Test
    void shouldReleaseDocumentAfterSuccess() throws Exception {
        givenExtractedText(TEXT);
        when(cacheRepository.findById(anyString())).thenReturn(Optional.empty());
        when(aiClient.generate(anyString(), anyString(), anyString())).thenReturn(AI_RESPONSE);

        service.process(JOB_ID, document);

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(document).doesNotExist();
        assertThat(tempDir.resolve("job-" + JOB_ID)).doesNotExist();
    }

    @Test
    void shouldNotRestartTerminalJob() {
        job.setStatus(JobStatus.COMPLETED);
        job.setProgress(100);

        service.process(JOB_ID, document);

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getProgress()).isEqualTo(100);
        verifyNoInteractions(extractionService, publisher);
        assertThat(document).doesNotExist();
    }
}
