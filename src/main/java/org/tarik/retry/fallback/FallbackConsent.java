package org.tarik.retry.fallback;

/**
 * Asks whoever owns the session whether switching to the fallback model is acceptable.
 */
@FunctionalInterface
public interface FallbackConsent {
    boolean approve(String currentModel, String fallbackModel, Throwable error) throws Exception;

    static FallbackConsent autoAccept() {
        return (currentModel, fallbackModel, error) -> true;
    }
}
