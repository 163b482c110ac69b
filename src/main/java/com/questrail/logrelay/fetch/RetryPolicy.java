package com.questrail.logrelay.fetch;

import java.time.Duration;
import java.util.Objects;

/**
 * RetryPolicy
 * -----------------------------------------------------------------------------
 * Bounded exponential backoff for remote retrievals.
 *
 * <p>After failed attempt {@code n} (1-based) that is not the last, the fetcher
 * waits {@code 2^n * baseDelay}: with the defaults that is 2s, then 4s.</p>
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay)
{
    public RetryPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (maxAttempts > 30) {
            throw new IllegalArgumentException("maxAttempts must be <= 30");
        }
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be non-negative");
        }
    }

    /**
     * Three attempts, 1 second base delay.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1));
    }

    /**
     * Delay to wait after the given failed attempt.
     *
     * @param attempt 1-based attempt number
     */
    public Duration backoffAfter(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        return baseDelay.multipliedBy(1L << attempt);
    }
}
