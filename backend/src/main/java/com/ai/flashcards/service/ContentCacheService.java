package com.ai.flashcards.service;

import com.ai.flashcards.exception.CacheException;
import com.ai.flashcards.model.CacheEntry;
import com.ai.flashcards.model.CacheMetadata;
import com.ai.flashcards.model.CachedFlashcardSet;
import com.ai.flashcards.model.Difficulty;
import com.ai.flashcards.model.Flashcard;
import com.ai.flashcards.repository.FlashcardCacheRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * ContentCacheService keeps generated flashcards keyed by a fingerprint of the
 * source text and generation parameters, so identical requests never reach
 * the AI model twice.
 *
 * <p>
 * <b>Tiers:</b> a bounded in-memory map (entries valid for 24h) in front of the
 * {@code flashcard_cache} table (entries valid for 7 days). A durable hit is
 * copied back into memory.
 * </p>
 *
 * <p>
 * Caching is best-effort: durable-tier failures are logged and reported as a
 * miss or ignored, never thrown to the caller.
 * </p>
 */
@Slf4j
@Service
public class ContentCacheService {

    static final int HASHED_PREFIX_LENGTH = 1000;

    private final FlashcardCacheRepository cacheRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Duration memoryTtl;
    private final Duration durableTtl;
    private final Duration memoryMaxAge;
    private final int softCap;
    private final int targetSize;
    private final int hardCap;

    private final ConcurrentHashMap<String, CacheEntry> memoryCache = new ConcurrentHashMap<>();

    public ContentCacheService(
            FlashcardCacheRepository cacheRepository,
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${cache.memory.ttl-hours:24}") long memoryTtlHours,
            @Value("${cache.durable.ttl-days:7}") long durableTtlDays,
            @Value("${cache.memory.max-age-minutes:60}") long memoryMaxAgeMinutes,
            @Value("${cache.memory.soft-cap:100}") int softCap,
            @Value("${cache.memory.target-size:80}") int targetSize,
            @Value("${cache.memory.hard-cap:150}") int hardCap) {
        this.cacheRepository = cacheRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.memoryTtl = Duration.ofHours(memoryTtlHours);
        this.durableTtl = Duration.ofDays(durableTtlDays);
        this.memoryMaxAge = Duration.ofMinutes(memoryMaxAgeMinutes);
        this.softCap = softCap;
        this.targetSize = targetSize;
        this.hardCap = hardCap;
    }

    // ── Key ───────────────────────────────────────────────────────────────

    /**
     * Computes the cache key: lowercase hex MD5 over the first 1000 characters
     * of the text, the subject, the difficulty and the enabled focus areas in
     * sorted order. MD5 serves only as a content fingerprint here.
     */
    public String contentHash(String text, String subject, Difficulty difficulty, Map<String, Boolean> focusAreas) {
        String prefix = text == null ? "" : text.substring(0, Math.min(text.length(), HASHED_PREFIX_LENGTH));
        String material = prefix + "|" + subject + "|" + difficulty.getValue() + "|" + canonicalFocusAreas(focusAreas);
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] digest = md.digest(material.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(32);
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm not available", e);
        }
    }

    /**
     * Enabled focus areas, sorted and comma-joined.
     */
    public static String canonicalFocusAreas(Map<String, Boolean> focusAreas) {
        if (focusAreas == null) {
            return "";
        }
        return focusAreas.entrySet().stream()
                .filter(e -> Boolean.TRUE.equals(e.getValue()))
                .map(Map.Entry::getKey)
                .sorted()
                .collect(Collectors.joining(","));
    }

    // ── Lookup ────────────────────────────────────────────────────────────

    public Optional<List<Flashcard>> get(String hash) {
        Instant now = clock.instant();

        CacheEntry cached = memoryCache.get(hash);
        if (cached != null) {
            if (ageOf(cached.getCreatedAt(), now).compareTo(memoryTtl) < 0) {
                log.debug("Memory cache hit for hash={}", hash);
                return Optional.of(cached.getFlashcards());
            }
            memoryCache.remove(hash, cached);
        }

        try {
            Optional<CacheEntry> durable = readDurable(hash);
            if (durable.isPresent() && ageOf(durable.get().getCreatedAt(), now).compareTo(durableTtl) < 0) {
                log.debug("Durable cache hit for hash={}", hash);
                memoryCache.put(hash, durable.get());
                return Optional.of(durable.get().getFlashcards());
            }
        } catch (CacheException e) {
            log.warn("Durable cache read failed for hash={}: {}", hash, e.getMessage());
        }
        return Optional.empty();
    }

    // ── Store ─────────────────────────────────────────────────────────────

    public void put(String hash, List<Flashcard> flashcards, CacheMetadata metadata) {
        String source = metadata.getSourceText() == null ? "" : metadata.getSourceText();
        CacheEntry entry = CacheEntry.builder()
                .contentHash(hash)
                .flashcards(List.copyOf(flashcards))
                .subject(metadata.getSubject())
                .difficulty(metadata.getDifficulty())
                .focusAreas(metadata.getFocusAreas())
                .createdAt(clock.instant())
                .sourceExcerpt(source.substring(0, Math.min(source.length(), HASHED_PREFIX_LENGTH)))
                .build();

        memoryCache.put(hash, entry);
        if (memoryCache.size() > hardCap) {
            enforceMemoryLimits();
        }

        try {
            writeDurable(entry);
        } catch (CacheException e) {
            log.warn("Durable cache write failed for hash={}; continuing without it: {}", hash, e.getMessage());
        }
    }

    public int memorySize() {
        return memoryCache.size();
    }

    // ── Maintenance ───────────────────────────────────────────────────────

    /**
     * Trims the memory tier: above the soft cap the oldest entries go until the
     * target size is reached, and any entry older than the max age goes
     * regardless of size.
     */
    @Scheduled(fixedRateString = "${cache.memory.sweep-interval-ms:600000}",
            initialDelayString = "${cache.memory.sweep-interval-ms:600000}")
    public synchronized void enforceMemoryLimits() {
        int before = memoryCache.size();

        if (memoryCache.size() > softCap) {
            List<CacheEntry> oldestFirst = new ArrayList<>(memoryCache.values());
            oldestFirst.sort(Comparator.comparing(CacheEntry::getCreatedAt));
            int excess = memoryCache.size() - targetSize;
            for (int i = 0; i < excess && i < oldestFirst.size(); i++) {
                CacheEntry victim = oldestFirst.get(i);
                memoryCache.remove(victim.getContentHash(), victim);
            }
        }

        Instant cutoff = clock.instant().minus(memoryMaxAge);
        memoryCache.values().removeIf(e -> e.getCreatedAt().isBefore(cutoff));

        int removed = before - memoryCache.size();
        if (removed > 0) {
            log.info("Memory cache sweep evicted {} entries ({} remain)", removed, memoryCache.size());
        }
    }

    /**
     * Deletes durable entries that can no longer produce a hit.
     */
    @Scheduled(fixedRateString = "${cache.durable.purge-interval-ms:3600000}",
            initialDelayString = "${cache.durable.purge-interval-ms:3600000}")
    public void purgeExpiredDurableEntries() {
        try {
            long deleted = cacheRepository.deleteByCreatedAtBefore(clock.instant().minus(durableTtl));
            if (deleted > 0) {
                log.info("Purged {} expired durable cache entries", deleted);
            }
        } catch (RuntimeException e) {
            log.warn("Durable cache purge failed: {}", e.getMessage());
        }
    }

    // ── Durable tier ──────────────────────────────────────────────────────

    private Optional<CacheEntry> readDurable(String hash) {
        try {
            Optional<CachedFlashcardSet> row = cacheRepository.findById(hash);
            if (row.isEmpty()) {
                return Optional.empty();
            }
            CachedFlashcardSet set = row.get();
            List<Flashcard> flashcards = objectMapper.readValue(set.getFlashcards(),
                    new TypeReference<List<Flashcard>>() {
                    });
            return Optional.of(CacheEntry.builder()
                    .contentHash(set.getContentHash())
                    .flashcards(flashcards)
                    .subject(set.getSubject())
                    .difficulty(set.getDifficulty())
                    .focusAreas(set.getFocusAreas())
                    .createdAt(set.getCreatedAt())
                    .sourceExcerpt(set.getSourceExcerpt())
                    .build());
        } catch (JsonProcessingException | RuntimeException e) {
            throw new CacheException("Could not read cache entry " + hash, e);
        }
    }

    private void writeDurable(CacheEntry entry) {
        try {
            cacheRepository.save(CachedFlashcardSet.builder()
                    .contentHash(entry.getContentHash())
                    .flashcards(objectMapper.writeValueAsString(entry.getFlashcards()))
                    .subject(entry.getSubject())
                    .difficulty(entry.getDifficulty())
                    .focusAreas(entry.getFocusAreas())
                    .sourceExcerpt(entry.getSourceExcerpt())
                    .createdAt(entry.getCreatedAt())
                    .build());
        } catch (JsonProcessingException | RuntimeException e) {
            throw new CacheException("Could not write cache entry " + entry.getContentHash(), e);
        }
    }

    private static Duration ageOf(Instant createdAt, Instant now) {
        return Duration.between(createdAt, now);
    }
}
