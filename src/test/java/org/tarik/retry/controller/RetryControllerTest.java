package org.tarik.retry.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tarik.retry.error.ServiceCallException;

import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.tarik.retry.controller.AuthMode.LOGIN_WITH_GOOGLE;
import static org.tarik.retry.controller.AuthMode.USE_GEMINI;
import static org.tarik.retry.controller.FailingOperation.SUCCESS;

class RetryControllerTest {
    private static final String FALLBACK_MODEL = "gemini-2.5-flash";

    private final RecordingBackoffTimer timer = new RecordingBackoffTimer();
    private final RetryController controller = new RetryController(new Random(42), timer);

    private static RetryPolicy policy(int maxAttempts) {
        return RetryPolicy.defaultPolicy().withMaxAttempts(maxAttempts).withDelays(100, 1000);
    }

    @Test
    @DisplayName("Should return the result of the first attempt without any delay")
    void shouldSucceedOnFirstAttempt() throws Exception {
        // Given
        var operation = new FailingOperation(0, 500);

        // When
        var result = controller.execute(operation, policy(5));

        // Then
        assertThat(result).isEqualTo(SUCCESS);
        assertThat(operation.getInvocations()).isEqualTo(1);
        assertThat(timer.getDelays()).isEmpty();
    }

    @Test
    @DisplayName("Should retry and succeed if failures are within max attempts")
    void shouldRetryAndSucceed() throws Exception {
        // Given
        var operation = new FailingOperation(2, 500);

        // When
        var result = controller.execute(operation, policy(3));

        // Then
        assertThat(result).isEqualTo(SUCCESS);
        assertThat(operation.getInvocations()).isEqualTo(3);
        assertThat(timer.getDelays()).hasSize(2);
    }

    @Test
    @DisplayName("Should rethrow the error of the last attempt once all attempts failed")
    void shouldFailWithLastErrorAfterMaxAttempts() {
        // Given
        var operation = new FailingOperation(10, 503);

        // When / Then
        assertThatThrownBy(() -> controller.execute(operation, policy(4)))
                .isSameAs(operation.getLastError())
                .hasMessage("Simulated error attempt 4");
        assertThat(operation.getInvocations()).isEqualTo(4);
        assertThat(timer.getDelays()).hasSize(3);
    }

    @Test
    @DisplayName("Should retry rate limit errors by default")
    void shouldRetryRateLimitErrorsByDefault() {
        // Given
        var operation = new FailingOperation(2, 429);

        // When / Then
        assertThatThrownBy(() -> controller.execute(operation, policy(2)))
                .hasMessage("Simulated error attempt 2");
        assertThat(operation.getInvocations()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should not retry client errors by default")
    void shouldNotRetryClientErrors() {
        // Given
        var operation = new FailingOperation(1, 400);

        // When / Then
        assertThatThrownBy(() -> controller.execute(operation, policy(5)))
                .hasMessage("Simulated error attempt 1");
        assertThat(operation.getInvocations()).isEqualTo(1);
        assertThat(timer.getDelays()).isEmpty();
    }

    @Test
    @DisplayName("Should not retry errors without status by default")
    void shouldNotRetryErrorsWithoutStatus() {
        // Given
        AtomicInteger attempts = new AtomicInteger();
        Callable<String> operation = () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("Broken");
        };

        // When / Then
        assertThatThrownBy(() -> controller.execute(operation, policy(5)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Broken");
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not retry if the custom predicate rejects the error")
    void shouldNotRetryIfPredicateRejects() {
        // Given
        var operation = new FailingOperation(5, 503);
        var retryPolicy = policy(5).withShouldRetry(error -> false);

        // When / Then
        assertThatThrownBy(() -> controller.execute(operation, retryPolicy))
                .hasMessage("Simulated error attempt 1");
        assertThat(operation.getInvocations()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should apply exponential backoff capped by the max delay, with jitter")
    void shouldRespectMaxDelay() throws Exception {
        // Given
        var operation = new FailingOperation(3, 500);
        var retryPolicy = RetryPolicy.defaultPolicy().withMaxAttempts(4).withDelays(100, 250);

        // When
        controller.execute(operation, retryPolicy);

        // Then
        var delays = timer.getDelaysMillis();
        assertThat(delays).hasSize(3);
        assertThat(delays.get(0)).isBetween(100 * 0.7, 100 * 1.3);
        assertThat(delays.get(1)).isBetween(200 * 0.7, 200 * 1.3);
        assertThat(delays.get(2)).isBetween(250 * 0.7, 250 * 1.3);
    }

    @Test
    @DisplayName("Should produce varied delays for identical nominal delays")
    void shouldApplyJitter() {
        // Given
        var firstTimer = new RecordingBackoffTimer();
        var secondTimer = new RecordingBackoffTimer();
        var retryPolicy = RetryPolicy.defaultPolicy().withMaxAttempts(2).withDelays(100, 1000);

        // When
        assertThatThrownBy(() -> new RetryController(new Random(), firstTimer)
                .execute(new FailingOperation(5, 500), retryPolicy));
        assertThatThrownBy(() -> new RetryController(new Random(), secondTimer)
                .execute(new FailingOperation(5, 500), retryPolicy));

        // Then
        assertThat(firstTimer.getDelays()).hasSize(1);
        assertThat(secondTimer.getDelays()).hasSize(1);
        assertThat(firstTimer.getDelays().get(0)).isNotEqualTo(secondTimer.getDelays().get(0));
        List.of(firstTimer.getDelaysMillis().get(0), secondTimer.getDelaysMillis().get(0))
                .forEach(delay -> assertThat(delay).isBetween(70.0, 130.0));
    }

    @Test
    @DisplayName("Should fall back after two consecutive rate limit errors and continue the operation")
    void shouldFallBackAfterPersistentRateLimit() throws Exception {
        // Given
        var handler = mock(PersistentRateLimitHandler.class);
        when(handler.onPersistentRateLimit(any(), any())).thenReturn(FALLBACK_MODEL);
        var operation = new FailingOperation(2, 429);
        var retryPolicy = policy(3).withPersistentRateLimitHandler(handler, LOGIN_WITH_GOOGLE);

        // When
        var result = controller.execute(operation, retryPolicy);

        // Then
        assertThat(result).isEqualTo(SUCCESS);
        assertThat(operation.getInvocations()).isEqualTo(3);
        verify(handler, times(1)).onPersistentRateLimit(LOGIN_WITH_GOOGLE, operation.getError(2));
        // Only the wait after the first rate limit error, the attempt after the fallback is immediate
        assertThat(timer.getDelays()).hasSize(1);
    }

    @Test
    @DisplayName("Should fall back even if the second rate limit error is the last attempt of the budget")
    void shouldFallBackOnLastAttempt() throws Exception {
        // Given
        var handler = mock(PersistentRateLimitHandler.class);
        when(handler.onPersistentRateLimit(any(), any())).thenReturn(FALLBACK_MODEL);
        var operation = new FailingOperation(2, 429);
        var retryPolicy = policy(2).withPersistentRateLimitHandler(handler, LOGIN_WITH_GOOGLE);

        // When
        var result = controller.execute(operation, retryPolicy);

        // Then
        assertThat(result).isEqualTo(SUCCESS);
        assertThat(operation.getInvocations()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should grant a fresh attempt budget after the fallback")
    void shouldResetAttemptsAfterFallback() throws Exception {
        // Given
        var handler = mock(PersistentRateLimitHandler.class);
        when(handler.onPersistentRateLimit(any(), any())).thenReturn(FALLBACK_MODEL);
        var operation = new FailingOperation(10, 429);
        var retryPolicy = policy(3).withPersistentRateLimitHandler(handler, LOGIN_WITH_GOOGLE);

        // When / Then
        assertThatThrownBy(() -> controller.execute(operation, retryPolicy))
                .hasMessage("Simulated error attempt 5");
        // 2 attempts before the fallback + 3 attempts of the fresh budget
        assertThat(operation.getInvocations()).isEqualTo(5);
        verify(handler, times(1)).onPersistentRateLimit(any(), any());
    }

    @Test
    @DisplayName("Should not fall back for API key users")
    void shouldNotFallBackForApiKeyUsers() throws Exception {
        // Given
        var handler = mock(PersistentRateLimitHandler.class);
        var operation = new FailingOperation(3, 429);
        var retryPolicy = policy(3).withPersistentRateLimitHandler(handler, USE_GEMINI);

        // When / Then
        assertThatThrownBy(() -> controller.execute(operation, retryPolicy))
                .hasMessage("Simulated error attempt 3");
        assertThat(operation.getInvocations()).isEqualTo(3);
        verifyNoInteractions(handler);
    }

    @Test
    @DisplayName("Should not fall back without a known auth mode")
    void shouldNotFallBackWithoutAuthMode() throws Exception {
        // Given
        var handler = mock(PersistentRateLimitHandler.class);
        var operation = new FailingOperation(3, 429);
        var retryPolicy = policy(3).withPersistentRateLimitHandler(handler, null);

        // When / Then
        assertThatThrownBy(() -> controller.execute(operation, retryPolicy))
                .hasMessage("Simulated error attempt 3");
        verifyNoInteractions(handler);
    }

    @Test
    @DisplayName("Should continue with the original error if the fallback is declined")
    void shouldContinueWithOriginalErrorIfFallbackDeclined() throws Exception {
        // Given
        var handler = mock(PersistentRateLimitHandler.class);
        when(handler.onPersistentRateLimit(any(), any())).thenReturn(null);
        var operation = new FailingOperation(3, 429);
        var retryPolicy = policy(3).withPersistentRateLimitHandler(handler, LOGIN_WITH_GOOGLE);

        // When / Then
        assertThatThrownBy(() -> controller.execute(operation, retryPolicy))
                .isSameAs(operation.getLastError())
                .hasMessage("Simulated error attempt 3");
        assertThat(operation.getInvocations()).isEqualTo(3);
        verify(handler, times(1)).onPersistentRateLimit(LOGIN_WITH_GOOGLE, operation.getError(2));
    }

    @Test
    @DisplayName("Should continue with the original error if the fallback handler fails")
    void shouldContinueWithOriginalErrorIfFallbackFails() throws Exception {
        // Given
        var handler = mock(PersistentRateLimitHandler.class);
        when(handler.onPersistentRateLimit(any(), any())).thenThrow(new IllegalStateException("No fallback"));
        var operation = new FailingOperation(3, 429);
        var retryPolicy = policy(3).withPersistentRateLimitHandler(handler, LOGIN_WITH_GOOGLE);

        // When / Then
        assertThatThrownBy(() -> controller.execute(operation, retryPolicy))
                .isSameAs(operation.getLastError());
        assertThat(operation.getInvocations()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should only count consecutive rate limit errors")
    void shouldOnlyCountConsecutiveRateLimitErrors() throws Exception {
        // Given
        var fallbackOccurred = new AtomicBoolean(false);
        var attempts = new AtomicInteger();
        var invocationsAtFallback = new AtomicInteger();
        int[] statuses = {429, 500, 429, 500, 429, 429};
        Callable<String> operation = () -> {
            int attempt = attempts.incrementAndGet();
            if (fallbackOccurred.get()) {
                return SUCCESS;
            }
            throw new ServiceCallException("Attempt " + attempt, statuses[attempt - 1]);
        };
        PersistentRateLimitHandler handler = (authMode, error) -> {
            fallbackOccurred.set(true);
            invocationsAtFallback.set(attempts.get());
            return FALLBACK_MODEL;
        };
        var retryPolicy = policy(10).withPersistentRateLimitHandler(handler, LOGIN_WITH_GOOGLE);

        // When
        var result = controller.execute(operation, retryPolicy);

        // Then
        assertThat(result).isEqualTo(SUCCESS);
        assertThat(invocationsAtFallback.get()).isEqualTo(6);
        assertThat(attempts.get()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should not count retryable errors other than rate limits towards the fallback")
    void shouldNotCountOtherRetryableErrorsTowardsFallback() throws Exception {
        // Given
        var handler = mock(PersistentRateLimitHandler.class);
        var operation = new FailingOperation(4, 418);
        var retryPolicy = policy(4)
                .withShouldRetry(error -> true)
                .withPersistentRateLimitHandler(handler, LOGIN_WITH_GOOGLE);

        // When / Then
        assertThatThrownBy(() -> controller.execute(operation, retryPolicy))
                .hasMessage("Simulated error attempt 4");
        assertThat(operation.getInvocations()).isEqualTo(4);
        verifyNoInteractions(handler);
    }

    @Test
    @DisplayName("Should propagate the interruption of the operation without retrying")
    void shouldPropagateInterruptionOfOperation() {
        // Given
        var retryPolicy = policy(5).withShouldRetry(error -> true);
        AtomicInteger attempts = new AtomicInteger();
        Callable<String> operation = () -> {
            attempts.incrementAndGet();
            throw new InterruptedException("Stopped");
        };

        // When / Then
        assertThatThrownBy(() -> controller.execute(operation, retryPolicy))
                .isInstanceOf(InterruptedException.class);
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should propagate the interruption of the wait between attempts")
    void shouldPropagateInterruptionOfBackoff() throws Exception {
        // Given
        var interruptingTimer = mock(BackoffTimer.class);
        doThrow(new InterruptedException("Stopped")).when(interruptingTimer).sleep(any());
        var interruptedController = new RetryController(new Random(), interruptingTimer);
        var operation = new FailingOperation(5, 500);

        // When / Then
        assertThatThrownBy(() -> interruptedController.execute(operation, policy(5)))
                .isInstanceOf(InterruptedException.class)
                .hasMessage("Stopped");
        assertThat(operation.getInvocations()).isEqualTo(1);
    }
}
