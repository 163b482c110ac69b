package com.questrail.logrelay.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;

/**
 * Client-to-server commands, decoded from inbound frames.
 */
public sealed interface ClientCommand
{
    /**
     * Request to subscribe to a key.
     *
     * @param key        the raw key as sent; {@code null} when absent or not a string
     * @param attributes the remaining request fields, already sanitized
     */
    record Subscribe(String key, JsonNode attributes) implements ClientCommand
    {
        public Subscribe {
            attributes = attributes == null ? JsonNodeFactory.instance.objectNode() : attributes;
        }
    }

    record Ping() implements ClientCommand
    {
    }

    /**
     * Any well-formed frame whose event name is not understood.
     */
    record Unsupported(String event) implements ClientCommand
    {
        public Unsupported {
            Objects.requireNonNull(event, "event");
        }
    }
}
