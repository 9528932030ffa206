package org.tarik.retry.controller;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static java.util.concurrent.CompletableFuture.delayedExecutor;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

public class SystemBackoffTimer implements BackoffTimer {

    @Override
    public void sleep(Duration delay) throws InterruptedException {
        NANOSECONDS.sleep(delay.toNanos());
    }

    @Override
    public CompletableFuture<Void> schedule(Duration delay) {
        return CompletableFuture.runAsync(() -> {
        }, delayedExecutor(delay.toNanos(), NANOSECONDS));
    }
}
