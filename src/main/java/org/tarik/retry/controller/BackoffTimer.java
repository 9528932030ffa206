package org.tarik.retry.controller;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Suspension point between two attempts.
 */
public interface BackoffTimer {

    /**
     * Parks the calling thread for the given delay.
     */
    void sleep(Duration delay) throws InterruptedException;

    /**
     * Returns a future completed once the given delay has elapsed, without blocking the caller.
     */
    CompletableFuture<Void> schedule(Duration delay);
}
