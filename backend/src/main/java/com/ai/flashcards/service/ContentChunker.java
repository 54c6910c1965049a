package com.ai.flashcards.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * ContentChunker prepares extracted document text for the AI model: it strips
 * layout noise and splits long text into chunks that fit one prompt.
 */
@Slf4j
@Component
public class ContentChunker {

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern PAGE_NUMBER = Pattern.compile("^\\d+$");
    private static final Pattern PAGE_MARKER = Pattern.compile("^(page\\s+\\d+(\\s+of\\s+\\d+)?|\\d+\\s*of\\s*\\d+)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern RUNNING_HEADER = Pattern.compile("^(©|\\(c\\)\\s|copyright\\b).*",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern HAS_LETTER = Pattern.compile("\\p{L}");

    private final int minChunkSize;

    public ContentChunker(@Value("${flashcards.chunk.min-size:50}") int minChunkSize) {
        this.minChunkSize = minChunkSize;
    }

    /**
     * Drops lines that carry no study content: bare page numbers, "page x of y"
     * markers, copyright footers and lines without any letters. Returns the
     * input unchanged when every line would be dropped.
     */
    public String preprocess(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String filtered = text.lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .filter(line -> !isNoise(line))
                .collect(Collectors.joining("\n"));

        if (filtered.isBlank()) {
            log.debug("Noise filter removed every line; keeping unfiltered text");
            return text.trim();
        }
        return filtered;
    }

    /**
     * Splits text into chunks of at most {@code maxChunkSize} characters.
     *
     * <p>
     * Text that already fits comes back as a single trimmed chunk. Longer text is
     * split on sentence boundaries; a sentence longer than the limit is split on
     * word boundaries instead, and a single word longer than the limit becomes a
     * chunk of its own. Chunks shorter than the minimum content size are dropped.
     * </p>
     *
     * @return chunks in document order; empty for blank input
     */
    public List<String> chunk(String text, int maxChunkSize) {
        if (maxChunkSize <= 0) {
            throw new IllegalArgumentException("maxChunkSize must be positive: " + maxChunkSize);
        }
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String trimmed = text.trim();
        if (trimmed.length() <= maxChunkSize) {
            return List.of(trimmed);
        }

        List<String> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        for (String sentence : SENTENCE_BOUNDARY.split(trimmed)) {
            String s = WHITESPACE.matcher(sentence).replaceAll(" ").trim();
            if (s.isEmpty()) {
                continue;
            }
            if (s.length() > maxChunkSize) {
                flush(current, chunks);
                splitOnWords(s, maxChunkSize, chunks);
                continue;
            }
            int needed = current.length() == 0 ? s.length() : current.length() + 1 + s.length();
            if (needed > maxChunkSize) {
                flush(current, chunks);
            }
            if (current.length() > 0) {
                current.append(' ');
            }
            current.append(s);
        }
        flush(current, chunks);

        List<String> kept = chunks.stream()
                .filter(c -> c.length() >= minChunkSize)
                .collect(Collectors.toList());
        log.debug("Chunked {} chars into {} chunk(s) (dropped {} below {} chars)",
                trimmed.length(), kept.size(), chunks.size() - kept.size(), minChunkSize);
        return kept;
    }

    /**
     * Cards to request per chunk: {@code ceil(total / chunkCount)}.
     */
    public static int cardsPerChunk(int totalCards, int chunkCount) {
        if (chunkCount <= 0) {
            return totalCards;
        }
        return (totalCards + chunkCount - 1) / chunkCount;
    }

    private void splitOnWords(String sentence, int maxChunkSize, List<String> chunks) {
        StringBuilder current = new StringBuilder();
        for (String word : WHITESPACE.split(sentence)) {
            int needed = current.length() == 0 ? word.length() : current.length() + 1 + word.length();
            if (needed > maxChunkSize) {
                flush(current, chunks);
            }
            if (current.length() > 0) {
                current.append(' ');
            }
            current.append(word);
        }
        flush(current, chunks);
    }

    private static void flush(StringBuilder current, List<String> chunks) {
        if (current.length() > 0) {
            chunks.add(current.toString());
            current.setLength(0);
        }
    }

    private static boolean isNoise(String line) {
        return PAGE_NUMBER.matcher(line).matches()
                || PAGE_MARKER.matcher(line).matches()
                || RUNNING_HEADER.matcher(line).matches()
                || !HAS_LETTER.matcher(line).find();
    }
}
