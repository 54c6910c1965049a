package com.ai.flashcards.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;

/**
 * Per-user monthly usage counters.
 *
 * <p>
 * {@code resetMonth} names the calendar month ({@code yyyy-MM}) the counters
 * belong to. Counters are only changed through the repository's atomic
 * increment, which restarts them when the month has rolled over.
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "usage_quotas")
public class QuotaRecord implements Persistable<String> {

    @Id
    @Column(nullable = false, updatable = false)
    private String userId;

    @Column(nullable = false)
    private int uploadsThisMonth;

    @Column(nullable = false)
    private int pagesThisMonth;

    /** Optional monthly page budget; null means only the per-file cap applies. */
    @Column
    private Integer maxMonthlyPages;

    @Column(nullable = false, length = 7)
    private String resetMonth;

    @Column(nullable = false)
    private boolean premium;

    @Column
    private LocalDateTime lastUpdatedAt;

    /** Set on freshly built records so that saving them issues an INSERT, never a merge. */
    @Transient
    @Builder.Default
    private boolean newRecord = false;

    @Override
    public String getId() {
        return userId;
    }

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        newRecord = false;
    }

    public SubscriptionTier getTier() {
        return SubscriptionTier.of(premium);
    }
}
