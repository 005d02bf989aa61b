package org.carball.rightsizer.ai;

import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class TransientFailurePredicateTest {

    private final TransientFailurePredicate predicate = new TransientFailurePredicate();

    @Test
    void shouldRetryRateLimitsAndServerErrors() {
        assertThat(predicate.test(new CompletionException("OpenAI request failed with status 429: slow down"))).isTrue();
        assertThat(predicate.test(new CompletionException("Rate limit reached for requests"))).isTrue();
        assertThat(predicate.test(new CompletionException("status 503: service overloaded"))).isTrue();
        assertThat(predicate.test(new CompletionException("Request timed out"))).isTrue();
    }

    @Test
    void shouldInspectCauseChain() {
        // Given
        RuntimeException wrapped = new CompletionException("request failed",
                new RuntimeException("io", new SocketTimeoutException("read")));

        // Then
        assertThat(predicate.test(wrapped)).isTrue();
    }

    @Test
    void shouldNotRetryPermanentFailures() {
        assertThat(predicate.test(new CompletionException("OpenAI request failed with status 401: invalid key"))).isFalse();
        assertThat(predicate.test(new IllegalArgumentException("bad prompt"))).isFalse();
        assertThat(predicate.test(new RuntimeException((String) null))).isFalse();
    }

    @Test
    void shouldMatchStatusCodesAsWholeNumbers() {
        assertThat(predicate.test(new CompletionException("OpenAI request failed with status 502: bad gateway"))).isTrue();
        assertThat(predicate.test(new CompletionException("HTTP 500 Internal Server Error"))).isTrue();

        assertThat(predicate.test(new CompletionException("max_tokens must be <= 5000"))).isFalse();
        assertThat(predicate.test(new CompletionException("prompt exceeds 15030 characters"))).isFalse();
        assertThat(predicate.test(new CompletionException("invalid model gpt-4290"))).isFalse();
    }
}
