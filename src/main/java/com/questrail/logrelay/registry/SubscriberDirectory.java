package com.questrail.logrelay.registry;

import com.questrail.logrelay.transport.ClientEndpoint;

import java.util.List;

/**
 * Read-only view of who is subscribed to what.
 *
 * <p>The polling orchestrator consults this view instead of keeping its own
 * counts, so the registry stays the single source of truth for subscriber
 * numbers.</p>
 */
public interface SubscriberDirectory
{
    int subscriberCount(String key);

    /**
     * Endpoints currently subscribed to {@code key}, in subscription order.
     */
    List<ClientEndpoint> subscribersOf(String key);
}
