package org.tarik.retry.controller;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Escalation hook invoked once the remote service keeps rate limiting the caller.
 */
@FunctionalInterface
public interface PersistentRateLimitHandler {

    /**
     * @param authMode  the way the caller is authenticated.
     * @param lastError the last rate limit failure.
     * @return the target the remaining attempts will be executed against, or {@code null} if the escalation is
     * declined. The value is not interpreted by the retry controller.
     * @throws Exception if the escalation can't be performed; treated the same way as a decline.
     */
    @Nullable
    String onPersistentRateLimit(@NotNull AuthMode authMode, @NotNull Throwable lastError) throws Exception;
}
