/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.tarik.retry.controller;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.Random;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Exponential backoff with multiplicative jitter. The cap is applied to the base delay, the jittered delay may
 * exceed it by up to the maximum jitter factor.
 */
public class BackoffCalculator {
    static final double MIN_JITTER_FACTOR = 0.7;
    static final double MAX_JITTER_FACTOR = 1.3;
    private static final long NANOS_PER_MILLI = 1_000_000L;

    private final Random random;

    public BackoffCalculator(@NotNull Random random) {
        this.random = requireNonNull(random);
    }

    /**
     * @param retryNumber 1 for the retry after the first failed attempt.
     */
    public static long getBaseDelayMillis(@NotNull RetryPolicy policy, int retryNumber) {
        checkArgument(retryNumber > 0, "Retry number must be a positive number, got %s", retryNumber);
        long maxDelay = policy.maxDelayMillis();
        long delay = Math.min(policy.initialDelayMillis(), maxDelay);
        for (int i = 1; i < retryNumber && delay < maxDelay; i++) {
            delay = delay > maxDelay / 2 ? maxDelay : delay * 2;
        }
        return delay;
    }

    public Duration getJitteredDelay(@NotNull RetryPolicy policy, int retryNumber) {
        long baseDelayMillis = getBaseDelayMillis(policy, retryNumber);
        double jitterFactor = MIN_JITTER_FACTOR + random.nextDouble() * (MAX_JITTER_FACTOR - MIN_JITTER_FACTOR);
        return Duration.ofNanos(Math.round(baseDelayMillis * jitterFactor * NANOS_PER_MILLI));
    }
}
