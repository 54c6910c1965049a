package com.ai.flashcards.model;

/**
 * Subscription level and the usage limits attached to it.
 */
public enum SubscriptionTier {
    FREE(3, 20),
    PREMIUM(100, 100);

    private final int monthlyUploadLimit;
    private final int maxPagesPerFile;

    SubscriptionTier(int monthlyUploadLimit, int maxPagesPerFile) {
        this.monthlyUploadLimit = monthlyUploadLimit;
        this.maxPagesPerFile = maxPagesPerFile;
    }

    public int getMonthlyUploadLimit() {
        return monthlyUploadLimit;
    }

    public int getMaxPagesPerFile() {
        return maxPagesPerFile;
    }

    public static SubscriptionTier of(boolean premium) {
        return premium ? PREMIUM : FREE;
    }
}
