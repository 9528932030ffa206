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
import org.jetbrains.annotations.Nullable;
import org.tarik.retry.RetryConfig;
import org.tarik.retry.error.ErrorClassifier;

import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Configuration for retry logic.
 *
 * @param maxAttempts                Total number of attempts including the first one.
 * @param initialDelayMillis         Delay before the first retry in milliseconds.
 * @param maxDelayMillis             Maximum delay between retries (before jitter) in milliseconds.
 * @param shouldRetry                Decides whether a failure is worth another attempt.
 * @param persistentRateLimitHandler Optional escalation hook invoked after consecutive rate limit failures.
 * @param authMode                   Optional caller authentication mode, escalation is never offered without it.
 */
public record RetryPolicy(
        int maxAttempts,
        long initialDelayMillis,
        long maxDelayMillis,
        @NotNull Predicate<Throwable> shouldRetry,
        @Nullable PersistentRateLimitHandler persistentRateLimitHandler,
        @Nullable AuthMode authMode) {
    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final long DEFAULT_INITIAL_DELAY_MILLIS = 5000;
    public static final long DEFAULT_MAX_DELAY_MILLIS = 30000;

    public RetryPolicy {
        checkArgument(maxAttempts > 0, "Max attempts must be a positive number, got %s", maxAttempts);
        checkArgument(initialDelayMillis >= 0, "Initial delay can't be negative, got %s", initialDelayMillis);
        checkArgument(maxDelayMillis >= 0, "Max delay can't be negative, got %s", maxDelayMillis);
        requireNonNull(shouldRetry, "Retry predicate can't be null");
    }

    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_DELAY_MILLIS, DEFAULT_MAX_DELAY_MILLIS,
                ErrorClassifier::isRetryableByDefault, null, null);
    }

    public static RetryPolicy fromConfig() {
        return new RetryPolicy(RetryConfig.getMaxAttempts(), RetryConfig.getInitialDelayMillis(),
                RetryConfig.getMaxDelayMillis(), ErrorClassifier::isRetryableByDefault, null, null);
    }

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, initialDelayMillis, maxDelayMillis, shouldRetry,
                persistentRateLimitHandler, authMode);
    }

    public RetryPolicy withDelays(long initialDelayMillis, long maxDelayMillis) {
        return new RetryPolicy(maxAttempts, initialDelayMillis, maxDelayMillis, shouldRetry,
                persistentRateLimitHandler, authMode);
    }

    public RetryPolicy withShouldRetry(@NotNull Predicate<Throwable> shouldRetry) {
        return new RetryPolicy(maxAttempts, initialDelayMillis, maxDelayMillis, shouldRetry,
                persistentRateLimitHandler, authMode);
    }

    public RetryPolicy withPersistentRateLimitHandler(@Nullable PersistentRateLimitHandler handler,
                                                      @Nullable AuthMode authMode) {
        return new RetryPolicy(maxAttempts, initialDelayMillis, maxDelayMillis, shouldRetry, handler, authMode);
    }

    public boolean isEscalationAllowed() {
        return persistentRateLimitHandler != null && authMode != null && authMode.allowsEscalation();
    }
}
