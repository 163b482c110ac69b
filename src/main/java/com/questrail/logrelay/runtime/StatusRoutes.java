package com.questrail.logrelay.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.logrelay.internal.time.MonotonicClock;
import com.questrail.logrelay.internal.time.WallClock;
import com.questrail.logrelay.polling.PollerSnapshot;
import com.questrail.logrelay.polling.PollingOrchestrator;
import com.questrail.logrelay.registry.ConnectionRegistry;
import com.questrail.logrelay.transport.HttpRoutes;

import java.util.Objects;
import java.util.Optional;

/**
 * JSON bodies for {@code /}, {@code /health} and {@code /status}.
 */
final class StatusRoutes implements HttpRoutes
{
    private final ObjectMapper mapper;
    private final ConnectionRegistry registry;
    private final PollingOrchestrator orchestrator;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final String environment;
    private final String websocketPath;
    private final long startedAtNanos;

    StatusRoutes(
            ObjectMapper mapper,
            ConnectionRegistry registry,
            PollingOrchestrator orchestrator,
            MonotonicClock clock,
            WallClock wallClock,
            String environment,
            String websocketPath)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.environment = Objects.requireNonNull(environment, "environment");
        this.websocketPath = Objects.requireNonNull(websocketPath, "websocketPath");
        this.startedAtNanos = clock.nowNanos();
    }

    @Override
    public Optional<String> get(String path)
    {
        switch (path) {
            case "/":
                return Optional.of(render(info()));
            case "/health":
                return Optional.of(render(health()));
            case "/status":
                return Optional.of(render(status()));
            default:
                return Optional.empty();
        }
    }

    ObjectNode info()
    {
        ObjectNode node = mapper.createObjectNode();
        node.put("service", "log-relay");
        node.put("version", LogRelayRuntime.VERSION);
        node.put("websocketPath", websocketPath);
        ArrayNode endpoints = node.putArray("endpoints");
        endpoints.add("/health");
        endpoints.add("/status");
        return node;
    }

    ObjectNode health()
    {
        ObjectNode node = mapper.createObjectNode();
        node.put("status", "ok");
        node.put("timestamp", wallClock.now().toString());
        node.put("uptime", (clock.nowNanos() - startedAtNanos) / 1_000_000_000.0);
        node.put("environment", environment);
        node.put("version", LogRelayRuntime.VERSION);
        return node;
    }

    ObjectNode status()
    {
        ObjectNode node = mapper.createObjectNode();
        node.put("timestamp", wallClock.now().toString());
        node.put("connections", registry.connectionCount());
        node.put("subscribedConnections", registry.subscribedConnectionCount());
        ObjectNode subscribers = node.putObject("subscribers");
        registry.subscriberCounts().forEach(subscribers::put);

        ArrayNode pollers = node.putArray("pollers");
        for (PollerSnapshot snapshot : orchestrator.snapshots()) {
            ObjectNode p = pollers.addObject();
            p.put("key", snapshot.key());
            p.put("phase", snapshot.phase().name());
            p.put("cursor", snapshot.cursor());
            p.put("consecutiveFailures", snapshot.consecutiveFailures());
            p.put("createdAt", snapshot.createdAt().toString());
            snapshot.lastPollAt().ifPresent(at -> p.put("lastPollAt", at.toString()));
            snapshot.lastFailure().ifPresent(f -> p.put("lastFailure", f.toString()));
        }
        return node;
    }

    private String render(ObjectNode node)
    {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render status", e);
        }
    }
}
