package org.carball.rightsizer.ai;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryableOperationTest {

    private List<Duration> sleeps;
    private RetryableOperation retry;

    @BeforeEach
    void setUp() {
        sleeps = new ArrayList<>();
        retry = new RetryableOperation(new TransientFailurePredicate(), RetryableOperation.DEFAULT_BACKOFF, sleeps::add);
    }

    @Test
    void shouldSucceedAfterTransientFailures() {
        // Given
        AtomicInteger calls = new AtomicInteger();

        // When
        String result = retry.call("test", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new CompletionException("status 429: rate limit");
            }
            return "ok";
        });

        // Then
        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void shouldRethrowLastFailureWhenRetriesExhausted() {
        // Given
        AtomicInteger calls = new AtomicInteger();

        // When/Then
        assertThatThrownBy(() -> retry.call("test", () -> {
            calls.incrementAndGet();
            throw new CompletionException("status 429: rate limit");
        }))
                .isInstanceOf(CompletionException.class)
                .hasMessageContaining("429");
        assertThat(calls).hasValue(1 + retry.maxRetries());
    }

    @Test
    void shouldNotRetryPermanentFailure() {
        // Given
        AtomicInteger calls = new AtomicInteger();

        // When/Then
        assertThatThrownBy(() -> retry.call("test", () -> {
            calls.incrementAndGet();
            throw new IllegalArgumentException("invalid model");
        }))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void shouldStopWhenInterruptedDuringBackoff() {
        // Given
        RetryableOperation interrupted = new RetryableOperation(new TransientFailurePredicate(),
                RetryableOperation.DEFAULT_BACKOFF,
                duration -> {
                    throw new InterruptedException("shutdown");
                });

        // When/Then
        try {
            assertThatThrownBy(() -> interrupted.call("test", () -> {
                throw new CompletionException("timeout");
            }))
                    .isInstanceOf(CompletionException.class)
                    .hasMessageContaining("Interrupted")
                    .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            // clear the flag for the next test
            Thread.interrupted();
        }
    }
}
