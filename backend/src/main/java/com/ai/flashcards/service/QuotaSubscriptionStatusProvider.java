package com.ai.flashcards.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Reads subscription state from the premium flag on the user's quota record,
 * which the billing integration keeps current through {@link QuotaService#updateTier}.
 */
@Component
@RequiredArgsConstructor
public class QuotaSubscriptionStatusProvider implements SubscriptionStatusProvider {

    private final QuotaService quotaService;

    @Override
    public boolean hasActiveSubscription(String userId) {
        return quotaService.isPremium(userId);
    }
}
