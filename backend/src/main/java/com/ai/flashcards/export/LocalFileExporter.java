package com.ai.flashcards.export;

import com.ai.flashcards.model.ExportFormat;
import com.ai.flashcards.model.Flashcard;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes export artifacts to the local file system under
 * {@code <export.dir>/<jobId>/}. The artifact reference is the file path.
 */
@Slf4j
@Component
public class LocalFileExporter implements FlashcardExporter {

    static final String CSV_HEADER = "Question,Answer,Topic,Difficulty";
    static final String EXPORT_LABEL = "Flashcard Generator Export";

    private final Path exportRoot;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public LocalFileExporter(@Value("${flashcards.export.dir:exports}") String exportDir,
            ObjectMapper objectMapper, Clock clock) {
        this.exportRoot = Paths.get(exportDir).toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String produce(String jobId, List<Flashcard> flashcards, ExportFormat format) throws IOException {
        Path dir = jobDirectory(jobId);
        Files.createDirectories(dir);

        String content = switch (format) {
            case CSV -> toCsv(flashcards);
            case JSON -> toJson(flashcards);
            case QUIZLET -> toQuizlet(flashcards);
        };

        Path file = dir.resolve(format.getFileName());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        log.debug("Wrote {} export for job {}: {}", format, jobId, file);
        return file.toString();
    }

    @Override
    public Resource open(String reference) throws IOException {
        Path file = Paths.get(reference).toAbsolutePath().normalize();
        if (!file.startsWith(exportRoot) || !Files.isRegularFile(file)) {
            throw new NoSuchFileException(reference);
        }
        return new FileSystemResource(file);
    }

    // ── Formats ───────────────────────────────────────────────────────────────

    String toCsv(List<Flashcard> flashcards) {
        StringBuilder sb = new StringBuilder(CSV_HEADER);
        for (Flashcard card : flashcards) {
            sb.append('\n')
                    .append(quote(card.getFront())).append(',')
                    .append(quote(card.getBack())).append(',')
                    .append(quote(card.getSubject())).append(',')
                    .append(quote(card.getDifficulty() != null ? card.getDifficulty().getValue() : ""));
        }
        return sb.toString();
    }

    String toJson(List<Flashcard> flashcards) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode metadata = root.putObject("metadata");
        metadata.put("exportDate", clock.instant().toString());
        metadata.put("cardCount", flashcards.size());
        metadata.put("format", EXPORT_LABEL);

        ArrayNode cards = root.putArray("flashcards");
        for (Flashcard card : flashcards) {
            ObjectNode node = cards.addObject();
            node.put("question", card.getFront());
            node.put("answer", card.getBack());
            node.put("subject", card.getSubject() != null ? card.getSubject() : "");
            node.put("difficulty", card.getDifficulty() != null ? card.getDifficulty().getValue() : "intermediate");
            ArrayNode tags = node.putArray("tags");
            if (card.getTags() != null) {
                card.getTags().forEach(tags::add);
            }
        }
        return objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(root);
    }

    String toQuizlet(List<Flashcard> flashcards) {
        return flashcards.stream()
                .map(card -> flatten(card.getFront()) + "\t" + flatten(card.getBack()))
                .collect(Collectors.joining("\n"));
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private Path jobDirectory(String jobId) {
        Path dir = exportRoot.resolve(jobId).normalize();
        if (!dir.startsWith(exportRoot)) {
            throw new IllegalArgumentException("Invalid job id for export path: " + jobId);
        }
        return dir;
    }

    private static String quote(String value) {
        if (value == null) {
            return "\"\"";
        }
        String escaped = value.replace("\"", "\"\"").replace("\n", " ").replace("\r", "");
        return "\"" + escaped + "\"";
    }

    private static String flatten(String value) {
        if (value == null) {
            return "";
        }
        return value.replace('\t', ' ').replace('\n', ' ').replace("\r", "").trim();
    }
}
