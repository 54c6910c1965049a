package com.ai.flashcards.export;

import com.ai.flashcards.model.Difficulty;
import com.ai.flashcards.model.ExportFormat;
import com.ai.flashcards.model.Flashcard;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.Resource;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalFileExporterTest {

    @TempDir
    Path exportDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private LocalFileExporter exporter;

    private final List<Flashcard> cards = List.of(
            Flashcard.builder().front("What is \"ATP\"?").back("The cell's\nenergy currency")
                    .subject("Biology").difficulty(Difficulty.BEGINNER).tags(List.of("Biology", "energy")).build(),
            Flashcard.builder().front("Define\tosmosis").back("Diffusion of water")
                    .subject("Biology").difficulty(Difficulty.ADVANCED).build());

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-05-01T12:00:00Z"), ZoneOffset.UTC);
        exporter = new LocalFileExporter(exportDir.toString(), objectMapper, clock);
    }

    @Test
    void shouldQuoteEveryCsvFieldAndDoubleEmbeddedQuotes() {
        String csv = exporter.toCsv(cards);

        assertThat(csv.split("\n")).containsExactly(
                "Question,Answer,Topic,Difficulty",
                "\"What is \"\"ATP\"\"?\",\"The cell's energy currency\",\"Biology\",\"beginner\"",
                "\"Define\tosmosis\",\"Diffusion of water\",\"Biology\",\"advanced\"");
    }

    @Test
    void shouldWriteJsonWithMetadataBlock() throws Exception {
        JsonNode root = objectMapper.readTree(exporter.toJson(cards));

        assertThat(root.path("metadata").path("exportDate").asText()).isEqualTo("2025-05-01T12:00:00Z");
        assertThat(root.path("metadata").path("cardCount").asInt()).isEqualTo(2);
        assertThat(root.path("metadata").path("format").asText()).isEqualTo("Flashcard Generator Export");
        assertThat(root.path("flashcards")).hasSize(2);
        assertThat(root.path("flashcards").get(0).path("question").asText()).isEqualTo("What is \"ATP\"?");
        assertThat(root.path("flashcards").get(0).path("tags")).hasSize(2);
    }

    @Test
    void shouldFlattenTabsAndNewlinesForQuizlet() {
        assertThat(exporter.toQuizlet(cards)).isEqualTo(
                "What is \"ATP\"?\tThe cell's energy currency\n"
                        + "Define osmosis\tDiffusion of water");
    }

    @Test
    void shouldWriteArtifactUnderJobDirectory() throws Exception {
        String reference = exporter.produce("job-1", cards, ExportFormat.QUIZLET);

        Path file = Path.of(reference);
        assertThat(file).exists().hasFileName("flashcards_quizlet.txt");
        assertThat(file.getParent().getFileName().toString()).isEqualTo("job-1");
        assertThat(Files.readString(file)).startsWith("What is");
    }

    @Test
    void shouldRejectJobIdsEscapingExportDirectory() {
        assertThatThrownBy(() -> exporter.produce("../outside", cards, ExportFormat.CSV))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldOpenProducedArtifactForDownload() throws Exception {
        String reference = exporter.produce("job-1", cards, ExportFormat.CSV);

        Resource resource = exporter.open(reference);

        assertThat(resource.exists()).isTrue();
        assertThat(new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8))
                .startsWith(LocalFileExporter.CSV_HEADER);
    }

    @Test
    void shouldRefuseToOpenFilesOutsideExportDirectory() throws Exception {
        Path outside = Files.createTempFile("outside", ".csv");
        try {
            assertThatThrownBy(() -> exporter.open(outside.toString()))
                    .isInstanceOf(NoSuchFileException.class);
        } finally {
            Files.deleteIfExists(outside);
        }
    }

    @Test
    void shouldReportMissingArtifact() {
        assertThatThrownBy(() -> exporter.open(exportDir.resolve("job-9/flashcards.csv").toString()))
                .isInstanceOf(NoSuchFileException.class);
    }
}
