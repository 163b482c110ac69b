package com.questrail.logrelay.api;

import java.util.Objects;
import java.util.Optional;

/**
 * RelayFailure
 * =============================================================================
 * The failures a client can be told about.
 *
 * <p>Transient fetch problems are not listed here. They are retried and
 * counted internally and only become visible to clients once a poller gives up,
 * as a {@link PollingThresholdExceeded}.</p>
 */
public sealed interface RelayFailure
{
    /** Short client-facing description. */
    String message();

    /** Optional additional detail. */
    Optional<String> details();

    /**
     * A subscription key or request payload failed validation.
     */
    record ValidationError(String message) implements RelayFailure
    {
        public ValidationError {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public Optional<String> details() {
            return Optional.empty();
        }
    }

    /**
     * The origin exhausted its request allowance for the current window.
     */
    record RateLimitExceeded(long retryAfterSeconds) implements RelayFailure
    {
        public RateLimitExceeded {
            if (retryAfterSeconds < 0) {
                throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
            }
        }

        @Override
        public String message() {
            return "Rate limit exceeded. Please try again later.";
        }

        @Override
        public Optional<String> details() {
            return Optional.of("Retry after " + retryAfterSeconds + " seconds");
        }
    }

    /**
     * A key's poller stopped after too many consecutive failed fetches.
     */
    record PollingThresholdExceeded(String key, int consecutiveFailures, String lastError) implements RelayFailure
    {
        public PollingThresholdExceeded {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(lastError, "lastError");
        }

        @Override
        public String message() {
            return "Polling stopped after repeated fetch failures";
        }

        @Override
        public Optional<String> details() {
            return Optional.of(lastError + " (key=" + key + ", failures=" + consecutiveFailures + ")");
        }
    }
}
