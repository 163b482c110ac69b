package com.questrail.logrelay.observability;

import java.time.Instant;
import java.util.Objects;

public record PollerTransitionEvent(
    Instant timestamp,
    String key,
    PollerPhase from,
    PollerPhase to,
    String reason
) {
    public PollerTransitionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(reason, "reason");
    }
}
