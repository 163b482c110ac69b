package com.questrail.logrelay.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * RelayEvent
 * =============================================================================
 * Server-to-client events.
 *
 * <p>These are semantic values only. How they are framed on the wire is the
 * business of {@code RelayFrameCodec}.</p>
 */
public sealed interface RelayEvent
{
    /** Wire name of the event. */
    String name();

    /**
     * Handshake sent once a connection is registered.
     */
    record Connected(String connectionId, Instant timestamp, Duration pollingInterval, int maxMessagesPerBatch)
            implements RelayEvent
    {
        public Connected {
            Objects.requireNonNull(connectionId, "connectionId");
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(pollingInterval, "pollingInterval");
        }

        @Override
        public String name() {
            return "connected";
        }
    }

    /**
     * Acknowledges an accepted subscription.
     */
    record Subscribed(String key, Instant timestamp, Duration interval) implements RelayEvent
    {
        public Subscribed {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(interval, "interval");
        }

        @Override
        public String name() {
            return "subscribed";
        }
    }

    /**
     * One relayed remote log entry.
     */
    record Message(JsonNode payload) implements RelayEvent
    {
        public Message {
            Objects.requireNonNull(payload, "payload");
        }

        @Override
        public String name() {
            return "message";
        }
    }

    /**
     * Client-visible failure notification.
     */
    record Error(String message, Optional<String> details, Instant timestamp) implements RelayEvent
    {
        public Error {
            Objects.requireNonNull(message, "message");
            Objects.requireNonNull(details, "details");
            Objects.requireNonNull(timestamp, "timestamp");
        }

        public static Error of(RelayFailure failure, Instant timestamp) {
            return new Error(failure.message(), failure.details(), timestamp);
        }

        public static Error of(String message, Instant timestamp) {
            return new Error(message, Optional.empty(), timestamp);
        }

        @Override
        public String name() {
            return "error";
        }
    }

    /**
     * Reply to a client {@code ping}. Carries epoch milliseconds.
     */
    record Pong(long timestampMillis) implements RelayEvent
    {
        @Override
        public String name() {
            return "pong";
        }
    }
}
