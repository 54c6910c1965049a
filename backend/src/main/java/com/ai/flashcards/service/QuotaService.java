package com.ai.flashcards.service;

import com.ai.flashcards.dto.QuotaStatus;
import com.ai.flashcards.dto.UploadDecision;
import com.ai.flashcards.exception.QuotaExceededException;
import com.ai.flashcards.exception.ValidationException;
import com.ai.flashcards.model.QuotaRecord;
import com.ai.flashcards.model.SubscriptionTier;
import com.ai.flashcards.repository.QuotaRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;

/**
 * QuotaService tracks and enforces monthly upload and page allowances.
 *
 * <p>
 * <b>Monthly reset:</b> counters are tagged with the month they belong to. A
 * read in a later month reports zero usage without writing; the next
 * {@link #increment} restarts the counters in the same statement that adds
 * the new upload, so a reset is never applied twice and concurrent uploads of
 * one user never overwrite each other.
 * </p>
 *
 * <p>
 * <b>Enforcement:</b> {@link #canUpload} is advisory. The limit is enforced by
 * {@link #increment}, whose update only matches while the user is under the
 * allowance, so two uploads racing for the last slot cannot both succeed.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuotaService {

    private static final DateTimeFormatter RESET_DATE_FORMAT = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.US);

    private final QuotaRecordRepository quotaRecordRepository;
    private final Clock clock;

    // ── Read ──────────────────────────────────────────────────────────────

    public QuotaStatus getQuota(String userId) {
        QuotaRecord record = findOrDefault(userId);
        boolean stale = !currentMonth().equals(record.getResetMonth());
        SubscriptionTier tier = record.getTier();

        int uploads = stale ? 0 : record.getUploadsThisMonth();
        int pages = stale ? 0 : record.getPagesThisMonth();

        return QuotaStatus.builder()
                .userId(userId)
                .uploadsThisMonth(uploads)
                .monthlyUploadLimit(tier.getMonthlyUploadLimit())
                .pagesThisMonth(pages)
                .maxPagesPerFile(tier.getMaxPagesPerFile())
                .maxMonthlyPages(record.getMaxMonthlyPages())
                .premium(record.isPremium())
                .needsReset(stale)
                .percentageUsed(Math.min(100, Math.round(uploads * 100f / tier.getMonthlyUploadLimit())))
                .build();
    }

    // ── Check ─────────────────────────────────────────────────────────────

    /**
     * Decides whether the user may upload a document with {@code pageCount} pages.
     * Nothing is written.
     */
    public UploadDecision canUpload(String userId, int pageCount) {
        if (pageCount < 1) {
            throw new ValidationException("Page count must be at least 1");
        }
        QuotaStatus quota = getQuota(userId);
        SubscriptionTier tier = SubscriptionTier.of(quota.isPremium());

        if (quota.getUploadsThisMonth() >= tier.getMonthlyUploadLimit()) {
            LocalDate resetDate = nextResetDate();
            long days = daysUntilReset();
            String reason = quota.isPremium()
                    ? String.format("You've reached your premium monthly limit of %d uploads. "
                            + "Your quota will reset in %d days on %s.",
                            tier.getMonthlyUploadLimit(), days, resetDate.format(RESET_DATE_FORMAT))
                    : String.format("You've reached your free tier limit of %d uploads this month. "
                            + "Upgrade to Premium for %d uploads per month, or wait %d days until %s "
                            + "for your quota to reset.",
                            tier.getMonthlyUploadLimit(), SubscriptionTier.PREMIUM.getMonthlyUploadLimit(),
                            days, resetDate.format(RESET_DATE_FORMAT));
            log.info("Upload denied for user={}: {}/{} uploads used", userId,
                    quota.getUploadsThisMonth(), tier.getMonthlyUploadLimit());
            return denied(reason, resetDate, days, !quota.isPremium());
        }

        int pagesWillProcess = Math.min(pageCount, tier.getMaxPagesPerFile());
        if (quota.getMaxMonthlyPages() != null) {
            int remaining = quota.getMaxMonthlyPages() - quota.getPagesThisMonth();
            pagesWillProcess = Math.min(pagesWillProcess, remaining);
        }

        if (pagesWillProcess <= 0) {
            LocalDate resetDate = nextResetDate();
            long days = daysUntilReset();
            String reason = String.format("You've used your monthly budget of %d pages. "
                    + "Your quota will reset in %d days on %s.",
                    quota.getMaxMonthlyPages(), days, resetDate.format(RESET_DATE_FORMAT));
            log.info("Upload denied for user={}: page budget exhausted", userId);
            return denied(reason, resetDate, days, !quota.isPremium());
        }

        return UploadDecision.builder()
                .allowed(true)
                .pagesWillProcess(pagesWillProcess)
                .build();
    }

    /**
     * Same as {@link #canUpload} but raises {@link QuotaExceededException} on denial.
     *
     * @return pages that will be processed
     */
    public int requireUpload(String userId, int pageCount) {
        UploadDecision decision = canUpload(userId, pageCount);
        if (!decision.isAllowed()) {
            throw new QuotaExceededException(decision.getReason(),
                    decision.getNextResetDate(), decision.getDaysUntilReset());
        }
        return decision.getPagesWillProcess();
    }

    // ── Write ─────────────────────────────────────────────────────────────

    /**
     * Records one upload of {@code pagesProcessed} pages as a single conditional
     * update. Nothing is written when the upload would take the user past the
     * upload limit of their tier or past their monthly page budget.
     *
     * @throws QuotaExceededException when the allowance is already used up
     */
    public void increment(String userId, int pagesProcessed) {
        String month = currentMonth();
        LocalDateTime now = LocalDateTime.now(clock);

        int updated = guardedIncrement(userId, pagesProcessed, month, now);
        if (updated == 0 && !quotaRecordRepository.existsById(userId)) {
            createIfAbsent(userId, month);
            updated = guardedIncrement(userId, pagesProcessed, month, now);
        }
        if (updated == 0) {
            log.info("Upload refused for user={}: guarded quota update matched no row", userId);
            throw exceeded(userId, pagesProcessed);
        }
        log.debug("Quota incremented for user={} (+1 upload, +{} pages, month={})", userId, pagesProcessed, month);
    }

    /**
     * Gives back an upload recorded by {@link #increment} for a job that never
     * started. Usage from an earlier month is not touched.
     */
    public void refund(String userId, int pagesProcessed) {
        int updated = quotaRecordRepository.refundUsage(userId, pagesProcessed, currentMonth(),
                LocalDateTime.now(clock));
        if (updated == 0) {
            log.warn("No current-month usage to refund for user={}", userId);
            return;
        }
        log.info("Quota refunded for user={} (-1 upload, -{} pages)", userId, pagesProcessed);
    }

    /**
     * Applies a subscription change reported by the billing collaborator.
     */
    public void updateTier(String userId, boolean premium) {
        createIfAbsent(userId, currentMonth());
        QuotaRecord record = quotaRecordRepository.findById(userId)
                .orElseThrow(() -> new IllegalStateException("Quota record missing for user " + userId));
        record.setPremium(premium);
        record.setLastUpdatedAt(LocalDateTime.now(clock));
        quotaRecordRepository.save(record);
        log.info("User {} moved to {} tier", userId, SubscriptionTier.of(premium));
    }

    public boolean isPremium(String userId) {
        return quotaRecordRepository.findById(userId).map(QuotaRecord::isPremium).orElse(false);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private QuotaRecord findOrDefault(String userId) {
        Optional<QuotaRecord> record = quotaRecordRepository.findById(userId);
        return record.orElseGet(() -> newRecord(userId, currentMonth()));
    }

    private int guardedIncrement(String userId, int pages, String month, LocalDateTime now) {
        return quotaRecordRepository.incrementUsage(userId, pages, month,
                SubscriptionTier.FREE.getMonthlyUploadLimit(),
                SubscriptionTier.PREMIUM.getMonthlyUploadLimit(), now);
    }

    private QuotaExceededException exceeded(String userId, int pages) {
        UploadDecision decision = canUpload(userId, Math.max(1, pages));
        String reason = decision.isAllowed()
                ? "Your monthly upload allowance is used up."
                : decision.getReason();
        return new QuotaExceededException(reason, nextResetDate(), daysUntilReset());
    }

    private void createIfAbsent(String userId, String month) {
        if (quotaRecordRepository.existsById(userId)) {
            return;
        }
        try {
            quotaRecordRepository.saveAndFlush(newRecord(userId, month));
        } catch (DataIntegrityViolationException e) {
            log.debug("Quota record for user={} created concurrently", userId);
        }
    }

    private QuotaRecord newRecord(String userId, String month) {
        return QuotaRecord.builder()
                .userId(userId)
                .uploadsThisMonth(0)
                .pagesThisMonth(0)
                .resetMonth(month)
                .premium(false)
                .lastUpdatedAt(LocalDateTime.now(clock))
                .newRecord(true)
                .build();
    }

    private UploadDecision denied(String reason, LocalDate resetDate, long days, boolean upgradeAvailable) {
        return UploadDecision.builder()
                .allowed(false)
                .reason(reason)
                .pagesWillProcess(0)
                .nextResetDate(resetDate)
                .daysUntilReset(days)
                .upgradeAvailable(upgradeAvailable)
                .build();
    }

    private String currentMonth() {
        return YearMonth.now(clock).toString();
    }

    private LocalDate nextResetDate() {
        return YearMonth.now(clock).plusMonths(1).atDay(1);
    }

    private long daysUntilReset() {
        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime reset = nextResetDate().atStartOfDay(clock.getZone());
        long millis = Duration.between(now, reset).toMillis();
        long dayMillis = Duration.ofDays(1).toMillis();
        return (millis + dayMillis - 1) / dayMillis;
    }
}
