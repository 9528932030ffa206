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
package org.tarik.retry.error;

import dev.langchain4j.exception.HttpException;
import org.jetbrains.annotations.NotNull;

import java.util.OptionalInt;
import java.util.concurrent.CancellationException;

import static org.tarik.retry.error.ErrorCategory.*;

/**
 * Classifies failures of remote service calls by the numeric status they carry. The status is looked up along the
 * whole cause chain, so wrapped failures are classified the same way as the original ones.
 */
public final class ErrorClassifier {
    public static final int RATE_LIMIT_STATUS = 429;
    private static final int MAX_CAUSE_CHAIN_DEPTH = 20;

    private ErrorClassifier() {
    }

    public static OptionalInt getStatus(@NotNull Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_CHAIN_DEPTH) {
            if (current instanceof StatusAware statusAware && statusAware.getStatus().isPresent()) {
                return statusAware.getStatus();
            }
            if (current instanceof HttpException httpException) {
                return OptionalInt.of(httpException.statusCode());
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return OptionalInt.empty();
    }

    public static ErrorCategory categorize(@NotNull Throwable error) {
        if (isCancellation(error)) {
            return CANCELLED;
        }
        var status = getStatus(error);
        if (status.isEmpty()) {
            return UNKNOWN;
        }
        int statusCode = status.getAsInt();
        if (statusCode == RATE_LIMIT_STATUS) {
            return RATE_LIMITED;
        }
        if (statusCode >= 500 && statusCode <= 599) {
            return TRANSIENT_SERVER_ERROR;
        }
        return NON_RETRYABLE_ERROR;
    }

    /**
     * Default retry predicate: only rate limit and server side failures are worth another attempt.
     */
    public static boolean isRetryableByDefault(@NotNull Throwable error) {
        var category = categorize(error);
        return category == RATE_LIMITED || category == TRANSIENT_SERVER_ERROR;
    }

    /**
     * Whether the failure counts towards the consecutive rate limit counter. This is independent of any retry
     * predicate, a custom predicate may retry failures which are not rate limits.
     */
    public static boolean isRateLimit(@NotNull Throwable error) {
        return getStatus(error).orElse(-1) == RATE_LIMIT_STATUS;
    }

    public static boolean isCancellation(@NotNull Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_CHAIN_DEPTH) {
            if (current instanceof InterruptedException || current instanceof CancellationException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
