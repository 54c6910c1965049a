package com.ai.flashcards.service;

/**
 * Answers whether a user holds an active paid subscription. Billing itself
 * lives elsewhere; this is the only question the pipeline asks of it.
 */
public interface SubscriptionStatusProvider {

    boolean hasActiveSubscription(String userId);
}
