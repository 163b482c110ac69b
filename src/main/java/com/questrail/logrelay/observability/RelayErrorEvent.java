package com.questrail.logrelay.observability;

import java.time.Instant;

/**
 * Record representing an unexpected error in the relay.
 */
public record RelayErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
