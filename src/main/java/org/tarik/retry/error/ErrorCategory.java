package org.tarik.retry.error;

/**
 * Categories of failures returned by a remote service call.
 * These categories determine the default retry strategy and whether a failure counts towards a model fallback.
 */
public enum ErrorCategory {
    /**
     * The service rejected the call because of rate limiting (status 429).
     * Retry: YES (Exponential backoff), counts towards the persistent rate limit fallback.
     */
    RATE_LIMITED,

    /**
     * The service failed with a server side error (status 5xx).
     * Retry: YES (Exponential backoff)
     */
    TRANSIENT_SERVER_ERROR,

    /**
     * The service rejected the call with any other status, e.g. a malformed request or missing permissions.
     * Retry: NO
     */
    NON_RETRYABLE_ERROR,

    /**
     * The call was interrupted or cancelled by the caller.
     * Retry: NO, the cancellation is propagated as is.
     */
    CANCELLED,

    /**
     * The failure carries no status at all.
     * Retry: NO
     */
    UNKNOWN
}
