package com.questrail.logrelay.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Record representing a connection lifecycle or subscription change.
 *
 * @param context sanitized extra fields of a subscription request; an empty
 *                object for events that carry none
 */
public record ConnectionEvent(
    Instant timestamp,
    Kind kind,
    String connectionId,
    String origin,
    Optional<String> key,
    JsonNode context
) {
    public enum Kind {
        CONNECTED,
        SUBSCRIBED,
        REJECTED,
        DISCONNECTED
    }

    public ConnectionEvent {
        Objects.requireNonNull(key, "key");
        context = context == null ? JsonNodeFactory.instance.objectNode() : context;
    }

    public ConnectionEvent(Instant timestamp, Kind kind, String connectionId, String origin, Optional<String> key) {
        this(timestamp, kind, connectionId, origin, key, null);
    }
}
