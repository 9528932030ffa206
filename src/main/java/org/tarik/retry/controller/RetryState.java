package org.tarik.retry.controller;

/**
 * Mutable counters of a single retry invocation. Never shared between invocations.
 */
class RetryState {
    static final int CONSECUTIVE_RATE_LIMITS_BEFORE_ESCALATION = 2;

    private int attemptNumber = 1;
    private int consecutiveRateLimitCount = 0;
    private boolean escalationOffered = false;

    int getAttemptNumber() {
        return attemptNumber;
    }

    int getConsecutiveRateLimitCount() {
        return consecutiveRateLimitCount;
    }

    boolean isEscalationOffered() {
        return escalationOffered;
    }

    void recordFailure(boolean rateLimit) {
        consecutiveRateLimitCount = rateLimit ? consecutiveRateLimitCount + 1 : 0;
    }

    boolean isEscalationDue(RetryPolicy policy) {
        return policy.isEscalationAllowed()
                && !escalationOffered
                && consecutiveRateLimitCount >= CONSECUTIVE_RATE_LIMITS_BEFORE_ESCALATION;
    }

    void markEscalationOffered() {
        escalationOffered = true;
    }

    void restartAfterEscalation() {
        attemptNumber = 1;
        consecutiveRateLimitCount = 0;
    }

    boolean isBudgetExhausted(RetryPolicy policy) {
        return attemptNumber >= policy.maxAttempts();
    }

    void nextAttempt() {
        attemptNumber++;
    }

    @Override
    public String toString() {
        return "RetryState{attemptNumber=%d, consecutiveRateLimitCount=%d, escalationOffered=%s}"
                .formatted(attemptNumber, consecutiveRateLimitCount, escalationOffered);
    }
}
