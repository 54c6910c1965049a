package com.ai.flashcards.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * TempFileService owns the temp directory: spooled uploads and per-job
 * scratch directories live there until the job releases them.
 *
 * <p>
 * Jobs delete their own files on every exit path. The periodic sweep is the
 * backstop for anything left behind by a crash; it deletes by file age alone.
 * </p>
 */
@Slf4j
@Service
public class TempFileService {

    private final Path tempRoot;
    private final Duration maxAge;
    private final Clock clock;

    public TempFileService(
            @Value("${flashcards.temp.dir:${java.io.tmpdir}/flashcards}") String tempDir,
            @Value("${flashcards.temp.max-age-minutes:60}") long maxAgeMinutes,
            Clock clock) {
        this.tempRoot = Paths.get(tempDir).toAbsolutePath().normalize();
        this.maxAge = Duration.ofMinutes(maxAgeMinutes);
        this.clock = clock;
    }

    /**
     * Copies an upload into the temp directory under a random name.
     */
    public Path spool(MultipartFile file, String extension) throws IOException {
        Files.createDirectories(tempRoot);
        Path target = tempRoot.resolve("upload-" + UUID.randomUUID() + extension);
        try (InputStream in = file.getInputStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("Spooled upload '{}' to {}", file.getOriginalFilename(), target);
        return target;
    }

    public Path createScratchDirectory(String jobId) throws IOException {
        Path dir = tempRoot.resolve("job-" + jobId);
        return Files.createDirectories(dir);
    }

    /**
     * Deletes a file or directory tree. Failures are logged; the sweep retries later.
     */
    public void release(Path path) {
        if (path == null || !Files.exists(path)) {
            return;
        }
        try {
            deleteRecursively(path);
            log.debug("Released temp path {}", path);
        } catch (IOException e) {
            log.warn("Could not delete temp path {}: {}", path, e.getMessage());
        }
    }

    /**
     * Deletes every entry directly under the temp directory whose last
     * modification is older than the configured age.
     *
     * @return number of entries removed
     */
    @Scheduled(fixedRateString = "${flashcards.temp.sweep-interval-ms:900000}")
    public int sweepExpired() {
        if (!Files.isDirectory(tempRoot)) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(maxAge);
        List<Path> candidates;
        try (Stream<Path> entries = Files.list(tempRoot)) {
            candidates = entries.collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Temp sweep could not list {}: {}", tempRoot, e.getMessage());
            return 0;
        }

        int removed = 0;
        for (Path entry : candidates) {
            try {
                Instant modified = Files.getLastModifiedTime(entry).toInstant();
                if (modified.isBefore(cutoff)) {
                    deleteRecursively(entry);
                    removed++;
                }
            } catch (IOException e) {
                log.warn("Temp sweep could not remove {}: {}", entry, e.getMessage());
            }
        }
        if (removed > 0) {
            log.info("Temp sweep removed {} expired entr{}", removed, removed == 1 ? "y" : "ies");
        }
        return removed;
    }

    public Path getTempRoot() {
        return tempRoot;
    }

    private static void deleteRecursively(Path path) throws IOException {
        if (!Files.isDirectory(path)) {
            Files.deleteIfExists(path);
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.deleteIfExists(p);
            }
        }
    }
}
