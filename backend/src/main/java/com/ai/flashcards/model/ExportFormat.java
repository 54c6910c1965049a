package com.ai.flashcards.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Artifact formats produced for a completed job.
 */
public enum ExportFormat {
    CSV("flashcards.csv", "text/csv", ".csv"),
    JSON("flashcards.json", "application/json", ".json"),
    QUIZLET("flashcards_quizlet.txt", "text/plain", "_quizlet.txt");

    private final String fileName;
    private final String contentType;
    private final String downloadSuffix;

    ExportFormat(String fileName, String contentType, String downloadSuffix) {
        this.fileName = fileName;
        this.contentType = contentType;
        this.downloadSuffix = downloadSuffix;
    }

    public String getFileName() {
        return fileName;
    }

    public String getContentType() {
        return contentType;
    }

    /** Lower-case name used in URLs and in a job's export map. */
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** File name offered to the browser, e.g. {@code StudyCards_<jobId>_quizlet.txt}. */
    public String downloadName(String jobId) {
        return "StudyCards_" + jobId + downloadSuffix;
    }

    public static Optional<ExportFormat> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(f -> f.getKey().equalsIgnoreCase(key.trim()))
                .findFirst();
    }
}
