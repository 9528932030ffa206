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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.retry.error.ErrorClassifier;

import java.time.Duration;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

import static java.lang.Thread.currentThread;
import static java.util.Objects.requireNonNull;
import static java.util.Optional.empty;
import static java.util.Optional.of;
import static java.util.concurrent.Executors.newCachedThreadPool;

/**
 * Executes an operation with exponential backoff retries. After two consecutive rate limit failures the policy's
 * {@link PersistentRateLimitHandler} is offered a single chance to escalate; an accepted escalation grants the
 * operation a fresh attempt budget and is retried without delay.
 * <p>
 * The controller keeps no state between invocations, so a single instance may serve any number of concurrent callers.
 * On the asynchronous path the escalation hook runs on a dedicated executor, so a hook waiting for user input never
 * blocks the thread which completed the failed attempt.
 */
public class RetryController {
    private static final Logger LOG = LoggerFactory.getLogger(RetryController.class);
    private static final Executor DEFAULT_ESCALATION_EXECUTOR = newCachedThreadPool(new ThreadFactoryBuilder()
            .setNameFormat("retry-escalation-%d")
            .setDaemon(true)
            .build());
    private final BackoffCalculator backoffCalculator;
    private final BackoffTimer backoffTimer;
    private final Executor escalationExecutor;

    public RetryController() {
        this(new Random(), new SystemBackoffTimer());
    }

    public RetryController(@NotNull Random random, @NotNull BackoffTimer backoffTimer) {
        this(random, backoffTimer, DEFAULT_ESCALATION_EXECUTOR);
    }

    public RetryController(@NotNull Random random, @NotNull BackoffTimer backoffTimer,
                           @NotNull Executor escalationExecutor) {
        this.backoffCalculator = new BackoffCalculator(random);
        this.backoffTimer = requireNonNull(backoffTimer);
        this.escalationExecutor = requireNonNull(escalationExecutor);
    }

    /**
     * Invokes the operation until it succeeds, fails with a non-retryable error or runs out of attempts.
     *
     * @return the result of the first successful attempt.
     * @throws Exception the failure of the last attempt, exactly as thrown by the operation, or
     *                   {@link InterruptedException} if the calling thread was interrupted while waiting for the
     *                   next attempt.
     */
    public <T> T execute(@NotNull Callable<T> operation, @NotNull RetryPolicy policy) throws Exception {
        var state = new RetryState();
        while (true) {
            try {
                return operation.call();
            } catch (Exception e) {
                if (currentThread().isInterrupted()) {
                    LOG.debug("Calling thread is interrupted, not retrying after attempt {}", state.getAttemptNumber());
                    throw e;
                }
                if (!recordFailure(e, state, policy)) {
                    throw e;
                }
                if (state.isEscalationDue(policy) && escalate(e, state, policy)) {
                    continue;
                }
                var delay = planBackoff(e, state, policy);
                if (delay.isEmpty()) {
                    throw e;
                }
                backoffTimer.sleep(delay.get());
            }
        }
    }

    /**
     * Asynchronous counterpart of {@link #execute(Callable, RetryPolicy)}. The waits between attempts don't block
     * any thread. Cancelling the returned future stops any further attempts and cancels the one in flight.
     */
    public <T> CompletableFuture<T> executeAsync(@NotNull Supplier<CompletableFuture<T>> operation,
                                                 @NotNull RetryPolicy policy) {
        var result = new CompletableFuture<T>();
        attemptAsync(operation, policy, new RetryState(), result);
        return result;
    }

    private <T> void attemptAsync(Supplier<CompletableFuture<T>> operation, RetryPolicy policy, RetryState state,
                                  CompletableFuture<T> result) {
        if (result.isDone()) {
            LOG.debug("Retry result is already completed, skipping attempt {}", state.getAttemptNumber());
            return;
        }

        var attempt = startAttempt(operation);
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                attempt.cancel(true);
            }
        });
        attempt.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            try {
                var failure = unwrap(error);
                if (result.isDone()) {
                    return;
                }
                if (!recordFailure(failure, state, policy)) {
                    result.completeExceptionally(failure);
                } else if (state.isEscalationDue(policy)) {
                    CompletableFuture.supplyAsync(() -> escalate(failure, state, policy), escalationExecutor)
                            .whenComplete((escalated, escalationError) -> {
                                if (escalationError != null) {
                                    result.completeExceptionally(unwrap(escalationError));
                                } else if (escalated) {
                                    attemptAsync(operation, policy, state, result);
                                } else {
                                    backOffAsync(failure, operation, policy, state, result);
                                }
                            });
                } else {
                    backOffAsync(failure, operation, policy, state, result);
                }
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        });
    }

    private <T> void backOffAsync(Throwable failure, Supplier<CompletableFuture<T>> operation, RetryPolicy policy,
                                  RetryState state, CompletableFuture<T> result) {
        if (result.isDone()) {
            return;
        }
        var delay = planBackoff(failure, state, policy);
        if (delay.isEmpty()) {
            result.completeExceptionally(failure);
            return;
        }
        backoffTimer.schedule(delay.get()).whenComplete((ignored, timerError) -> {
            if (timerError != null) {
                result.completeExceptionally(unwrap(timerError));
            } else {
                attemptAsync(operation, policy, state, result);
            }
        });
    }

    private static <T> CompletableFuture<T> startAttempt(Supplier<CompletableFuture<T>> operation) {
        try {
            return requireNonNull(operation.get(), "Operation returned no future");
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
    }

    /**
     * Updates the state according to the failure of the current attempt.
     *
     * @return false if the failure has to be propagated to the caller right away.
     */
    private boolean recordFailure(Throwable error, RetryState state, RetryPolicy policy) {
        if (ErrorClassifier.isCancellation(error)) {
            LOG.debug("Attempt {} was cancelled, not retrying", state.getAttemptNumber());
            return false;
        }
        if (!policy.shouldRetry().test(error)) {
            LOG.debug("Attempt {} failed with a non-retryable error ({}): {}", state.getAttemptNumber(),
                    ErrorClassifier.categorize(error), error.toString());
            return false;
        }
        state.recordFailure(ErrorClassifier.isRateLimit(error));
        return true;
    }

    /**
     * @return the delay before the next attempt, or empty if the attempt budget is exhausted.
     */
    private Optional<Duration> planBackoff(Throwable error, RetryState state, RetryPolicy policy) {
        if (state.isBudgetExhausted(policy)) {
            LOG.error("Operation failed after {} attempts. Last error: {}", state.getAttemptNumber(), error.toString());
            return empty();
        }

        var delay = backoffCalculator.getJitteredDelay(policy, state.getAttemptNumber());
        LOG.warn("Attempt {} failed{}: {}. Retrying in {}ms...", state.getAttemptNumber(), describeStatus(error),
                error.getMessage(), delay.toMillis());
        state.nextAttempt();
        return of(delay);
    }

    private boolean escalate(Throwable error, RetryState state, RetryPolicy policy) {
        var handler = requireNonNull(policy.persistentRateLimitHandler());
        var authMode = requireNonNull(policy.authMode());
        int consecutiveRateLimits = state.getConsecutiveRateLimitCount();
        state.markEscalationOffered();
        try {
            var target = handler.onPersistentRateLimit(authMode, error);
            if (target == null) {
                LOG.info("Escalation after {} consecutive rate limit errors was declined", consecutiveRateLimits);
                return false;
            }
            LOG.info("Escalated to '{}' after {} consecutive rate limit errors, restarting attempts",
                    target, consecutiveRateLimits);
            state.restartAfterEscalation();
            return true;
        } catch (InterruptedException e) {
            currentThread().interrupt();
            LOG.warn("Escalation was interrupted, continuing with the original error");
            return false;
        } catch (Exception e) {
            LOG.warn("Escalation failed, continuing with the original error", e);
            return false;
        }
    }

    private static String describeStatus(Throwable error) {
        var status = ErrorClassifier.getStatus(error);
        return status.isPresent() ? " with status " + status.getAsInt() : "";
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
