package com.questrail.logrelay.observability;

import com.questrail.logrelay.fetch.FetchFailure;

import java.time.Instant;

/**
 * A key's fetch failed after all retries.
 *
 * @param consecutiveFailures failures in a row for this key, including this one
 */
public record FetchFailureEvent(
    Instant timestamp,
    String key,
    FetchFailure failure,
    int consecutiveFailures
) {
}
