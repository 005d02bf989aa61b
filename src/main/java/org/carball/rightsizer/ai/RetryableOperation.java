package org.carball.rightsizer.ai;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Runs an operation, retrying failures the predicate accepts once per backoff entry. Any other
 * failure, or the last retryable one, is rethrown unchanged.
 */
@Slf4j
public class RetryableOperation {

    public static final List<Duration> DEFAULT_BACKOFF = List.of(Duration.ofSeconds(1), Duration.ofSeconds(2));

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Predicate<Throwable> retryable;
    private final List<Duration> backoff;
    private final Sleeper sleeper;

    public RetryableOperation(Predicate<Throwable> retryable, List<Duration> backoff, Sleeper sleeper) {
        this.retryable = retryable;
        this.backoff = List.copyOf(backoff);
        this.sleeper = sleeper;
    }

    public static RetryableOperation forTransientFailures() {
        return new RetryableOperation(new TransientFailurePredicate(), DEFAULT_BACKOFF,
                duration -> Thread.sleep(duration.toMillis()));
    }

    public <T> T call(String description, Supplier<T> operation) {
        int attempt = 0;
        while (true) {
            try {
                return operation.get();
            } catch (RuntimeException e) {
                if (attempt >= backoff.size() || !retryable.test(e)) {
                    throw e;
                }
                Duration delay = backoff.get(attempt);
                attempt++;
                log.debug("Retry {}/{} for {} after {}ms: {}",
                        attempt, backoff.size(), description, delay.toMillis(), e.getMessage());
                pause(delay, description, e);
            }
        }
    }

    public int maxRetries() {
        return backoff.size();
    }

    private void pause(Duration delay, String description, RuntimeException failure) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CompletionException interrupted =
                    new CompletionException("Interrupted while waiting to retry " + description, e);
            interrupted.addSuppressed(failure);
            throw interrupted;
        }
    }
}
