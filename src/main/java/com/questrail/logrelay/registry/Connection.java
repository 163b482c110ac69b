package com.questrail.logrelay.registry;

import com.questrail.logrelay.transport.ClientEndpoint;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of one registered connection.
 */
public record Connection(
        String id,
        ClientEndpoint endpoint,
        Optional<String> key,
        Instant createdAt,
        Instant lastActivity
) {
    public Connection {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(lastActivity, "lastActivity");
    }

    Connection withKey(String newKey) {
        return new Connection(id, endpoint, Optional.ofNullable(newKey), createdAt, lastActivity);
    }

    Connection touchedAt(Instant at) {
        return new Connection(id, endpoint, key, createdAt, at);
    }
}
