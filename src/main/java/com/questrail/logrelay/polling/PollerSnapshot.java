package com.questrail.logrelay.polling;

import com.questrail.logrelay.fetch.FetchFailure;
import com.questrail.logrelay.observability.PollerPhase;

import java.time.Instant;
import java.util.Optional;

/**
 * Point-in-time view of one key's poller, for status reporting.
 */
public record PollerSnapshot(
        String key,
        PollerPhase phase,
        int cursor,
        int consecutiveFailures,
        Instant createdAt,
        Optional<Instant> lastPollAt,
        Optional<FetchFailure> lastFailure
) {
}
