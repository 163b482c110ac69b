package com.questrail.logrelay.session;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One subscription attempt travelling through the {@link SubscriptionPipeline}.
 *
 * @param key        raw requested key; {@code null} if absent
 * @param attributes remaining request fields, sanitized
 * @param nowMillis  monotonic time of arrival, in milliseconds
 */
public record SubscriptionRequest(
        String connectionId,
        String origin,
        String key,
        JsonNode attributes,
        long nowMillis
) {
    public SubscriptionRequest {
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(attributes, "attributes");
    }
}
