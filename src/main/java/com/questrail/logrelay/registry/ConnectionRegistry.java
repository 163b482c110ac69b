package com.questrail.logrelay.registry;

import com.questrail.logrelay.internal.time.WallClock;
import com.questrail.logrelay.transport.ClientEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * ConnectionRegistry
 * =============================================================================
 * Tracks live connections and the (at most one) key each is subscribed to.
 *
 * <h2>Invariant</h2>
 * For every key, {@link #subscriberCount(String)} equals the number of
 * registered connections whose current key is that key. Both indexes are
 * updated under one monitor, so readers never observe them out of step.
 *
 * <h2>Scope</h2>
 * The registry holds no polling logic. Callers react to the counts it reports,
 * for example by telling the polling orchestrator that a key lost a subscriber.
 */
public final class ConnectionRegistry implements SubscriberDirectory
{
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final WallClock wallClock;
    private final Object monitor = new Object();
    private final Map<String, Connection> connections = new LinkedHashMap<>();
    private final Map<String, Set<String>> connectionsByKey = new HashMap<>();

    public ConnectionRegistry(WallClock wallClock)
    {
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Register a new, unsubscribed connection.
     *
     * @throws IllegalStateException if a connection with the same id is registered
     */
    public Connection connect(ClientEndpoint endpoint)
    {
        Objects.requireNonNull(endpoint, "endpoint");
        Instant now = wallClock.now();
        Connection connection = new Connection(endpoint.id(), endpoint, Optional.empty(), now, now);
        synchronized (monitor) {
            if (connections.containsKey(endpoint.id())) {
                throw new IllegalStateException("Connection already registered: " + endpoint.id());
            }
            connections.put(endpoint.id(), connection);
        }
        log.debug("Registered connection {} from {}", endpoint.id(), endpoint.origin());
        return connection;
    }

    /**
     * Remove a connection and its subscription. Unknown ids are ignored.
     *
     * @return the key the connection was subscribed to, if any
     */
    public Optional<String> disconnect(String connectionId)
    {
        synchronized (monitor) {
            Connection removed = connections.remove(connectionId);
            if (removed == null) {
                return Optional.empty();
            }
            removed.key().ifPresent(key -> detach(key, connectionId));
            log.debug("Removed connection {}", connectionId);
            return removed.key();
        }
    }

    /**
     * Associate a connection with {@code key}, dropping any previous key.
     *
     * @throws IllegalStateException if the connection is not registered
     */
    public SubscriptionChange subscribe(String connectionId, String key)
    {
        Objects.requireNonNull(key, "key");
        synchronized (monitor) {
            Connection connection = requireConnection(connectionId);
            Optional<String> previous = connection.key();

            if (previous.isPresent() && !previous.get().equals(key)) {
                detach(previous.get(), connectionId);
            }
            connectionsByKey.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(connectionId);
            connections.put(connectionId, connection.withKey(key).touchedAt(wallClock.now()));

            int previousCount = previous.map(this::countLocked).orElse(0);
            return new SubscriptionChange(previous, previousCount, key, countLocked(key));
        }
    }

    /**
     * Drop a connection's subscription while keeping the connection.
     *
     * @return the key that was dropped, if any
     */
    public Optional<String> unsubscribe(String connectionId)
    {
        synchronized (monitor) {
            Connection connection = connections.get(connectionId);
            if (connection == null || connection.key().isEmpty()) {
                return Optional.empty();
            }
            String key = connection.key().get();
            detach(key, connectionId);
            connections.put(connectionId, connection.withKey(null));
            return Optional.of(key);
        }
    }

    /**
     * Record inbound activity on a connection.
     */
    public void touch(String connectionId)
    {
        Instant now = wallClock.now();
        synchronized (monitor) {
            connections.computeIfPresent(connectionId, (id, c) -> c.touchedAt(now));
        }
    }

    public Optional<Connection> find(String connectionId)
    {
        synchronized (monitor) {
            return Optional.ofNullable(connections.get(connectionId));
        }
    }

    @Override
    public int subscriberCount(String key)
    {
        synchronized (monitor) {
            return countLocked(key);
        }
    }

    @Override
    public List<ClientEndpoint> subscribersOf(String key)
    {
        synchronized (monitor) {
            Set<String> ids = connectionsByKey.get(key);
            if (ids == null) {
                return List.of();
            }
            List<ClientEndpoint> endpoints = new ArrayList<>(ids.size());
            for (String id : ids) {
                endpoints.add(connections.get(id).endpoint());
            }
            return endpoints;
        }
    }

    public int connectionCount()
    {
        synchronized (monitor) {
            return connections.size();
        }
    }

    public int subscribedConnectionCount()
    {
        synchronized (monitor) {
            int total = 0;
            for (Set<String> ids : connectionsByKey.values()) {
                total += ids.size();
            }
            return total;
        }
    }

    /**
     * Subscriber count per key, sorted by key.
     */
    public Map<String, Integer> subscriberCounts()
    {
        synchronized (monitor) {
            Map<String, Integer> counts = new TreeMap<>();
            connectionsByKey.forEach((key, ids) -> counts.put(key, ids.size()));
            return counts;
        }
    }

    private Connection requireConnection(String connectionId)
    {
        Connection connection = connections.get(connectionId);
        if (connection == null) {
            throw new IllegalStateException("Unknown connection: " + connectionId);
        }
        return connection;
    }

    private void detach(String key, String connectionId)
    {
        Set<String> ids = connectionsByKey.get(key);
        if (ids != null) {
            ids.remove(connectionId);
            if (ids.isEmpty()) {
                connectionsByKey.remove(key);
            }
        }
    }

    private int countLocked(String key)
    {
        Set<String> ids = connectionsByKey.get(key);
        return ids == null ? 0 : ids.size();
    }
}
