package com.questrail.logrelay.transport;

import java.util.Optional;

/**
 * Read-only HTTP routes served next to the WebSocket endpoint.
 *
 * <p>The transport only knows paths and JSON bodies; what the bodies contain is
 * decided above the transport boundary.</p>
 */
@FunctionalInterface
public interface HttpRoutes
{
    /**
     * Render the JSON body for a {@code GET} of {@code path}.
     *
     * @return the body, or empty if no route matches
     */
    Optional<String> get(String path);
}
