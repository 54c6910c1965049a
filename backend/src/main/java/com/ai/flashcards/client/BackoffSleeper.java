package com.ai.flashcards.client;

/**
 * Waits between retry attempts.
 */
@FunctionalInterface
public interface BackoffSleeper {

    void sleep(long millis) throws InterruptedException;

    BackoffSleeper THREAD_SLEEP = Thread::sleep;
}
