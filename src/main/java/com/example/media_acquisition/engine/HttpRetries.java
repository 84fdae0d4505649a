package com.example.media_acquisition.engine;

import org.slf4j.Logger;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.netty.http.client.PrematureCloseException;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Retry policy shared by the HTTP clients: 5xx answers and broken connections are retried with backoff,
 * everything else (4xx, timeouts, parse errors) fails at once. After the last retry the original error
 * surfaces, not a retry-exhausted wrapper.
 */
final class HttpRetries {
    static final int RETRY_MAX_ATTEMPTS = 2;
    static final Duration RETRY_BACKOFF = Duration.ofMillis(200);

    private HttpRetries() {
    }

    static Retry transientFailures(Logger logger, String operation) {
        return Retry.backoff(RETRY_MAX_ATTEMPTS, RETRY_BACKOFF)
                .filter(HttpRetries::isRetryable)
                .doBeforeRetry(signal -> logger.warn("{} retry attempt={} cause={}",
                        operation,
                        signal.totalRetriesInARow() + 1,
                        signal.failure() == null ? "unknown" : signal.failure().toString()))
                .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure());
    }

    static boolean isRetryable(Throwable throwable) {
        if (throwable instanceof WebClientResponseException ex) {
            return ex.getStatusCode().is5xxServerError();
        }
        return throwable instanceof WebClientRequestException || throwable instanceof PrematureCloseException;
    }
}
