package com.questrail.logrelay.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.logrelay.admission.AdmissionLimiter;
import com.questrail.logrelay.config.RelayConfig;
import com.questrail.logrelay.dedup.DeduplicationIndex;
import com.questrail.logrelay.fetch.OkHttpRemoteLogFetcher;
import com.questrail.logrelay.fetch.RemoteLogFetcher;
import com.questrail.logrelay.fetch.RemoteLogResponseParser;
import com.questrail.logrelay.internal.time.MonotonicClock;
import com.questrail.logrelay.internal.time.ScheduledExecutorScheduler;
import com.questrail.logrelay.internal.time.SystemMonotonicClock;
import com.questrail.logrelay.internal.time.SystemWallClock;
import com.questrail.logrelay.internal.time.WallClock;
import com.questrail.logrelay.observability.NullObservabilitySink;
import com.questrail.logrelay.observability.RelayObservabilitySink;
import com.questrail.logrelay.polling.PollingOrchestrator;
import com.questrail.logrelay.protocol.RelayFrameCodec;
import com.questrail.logrelay.registry.ConnectionRegistry;
import com.questrail.logrelay.session.AdmissionStage;
import com.questrail.logrelay.session.KeyValidationStage;
import com.questrail.logrelay.session.RegistrationStage;
import com.questrail.logrelay.session.RelaySessionHandler;
import com.questrail.logrelay.session.SubscriptionPipeline;
import com.questrail.logrelay.transport.netty.NettyRelayServer;
import com.questrail.logrelay.validation.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * LogRelayRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the relay.
 *
 * <p>Wires the fetch client, deduplication index, connection registry, polling
 * orchestrator, subscription pipeline and Netty server from one
 * {@link RelayConfig}. Owns the polling executors and shuts them down: a small
 * scheduled pool that dispatches ticks, and a cached pool that grows with the
 * number of keys fetching at once.</p>
 */
public final class LogRelayRuntime {
    private static final Logger log = LoggerFactory.getLogger(LogRelayRuntime.class);

    public static final String VERSION = "0.1.0";

    private final RelayConfig config;
    private final RemoteLogFetcher fetcher;
    private final ConnectionRegistry registry;
    private final PollingOrchestrator orchestrator;
    private final NettyRelayServer server;
    private final ScheduledExecutorService pollingExecutor;
    private final ExecutorService fetchExecutor;

    private boolean started;
    private boolean stopped;

    private LogRelayRuntime(
            RelayConfig config,
            RemoteLogFetcher fetcher,
            ConnectionRegistry registry,
            PollingOrchestrator orchestrator,
            NettyRelayServer server,
            ScheduledExecutorService pollingExecutor,
            ExecutorService fetchExecutor) {
        this.config = config;
        this.fetcher = fetcher;
        this.registry = registry;
        this.orchestrator = orchestrator;
        this.server = server;
        this.pollingExecutor = pollingExecutor;
        this.fetchExecutor = fetchExecutor;
    }

    public synchronized void start() throws InterruptedException {
        if (started) {
            return;
        }
        started = true;
        log.info("Starting log relay {} with {}", VERSION, config);
        if (fetcher instanceof OkHttpRemoteLogFetcher http) {
            http.testConnection();
        }
        server.start();
    }

    /**
     * Stop accepting connections, tear down every poller and release threads.
     * Idempotent.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        log.info("Stopping log relay");

        server.stop();
        orchestrator.shutdown();
        awaitShutdown(pollingExecutor);
        awaitShutdown(fetchExecutor);
        if (fetcher instanceof OkHttpRemoteLogFetcher http) {
            http.close();
        }
    }

    private static void awaitShutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public int boundPort() {
        return server.boundPort();
    }

    public ConnectionRegistry registry() {
        return registry;
    }

    public PollingOrchestrator orchestrator() {
        return orchestrator;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RelayConfig config;
        private RelayObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private RemoteLogFetcher fetcher;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withConfig(RelayConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(RelayObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Replace the HTTP fetch client, e.g. with an in-memory source.
         */
        public Builder withFetcher(RemoteLogFetcher fetcher) {
            this.fetcher = fetcher;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public LogRelayRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            // 1. Shared infrastructure
            ObjectMapper mapper = new ObjectMapper();
            InputValidator validator = new InputValidator();
            RelayFrameCodec codec = new RelayFrameCodec(mapper, validator);
            ScheduledExecutorService executor =
                Executors.newScheduledThreadPool(config.pollingThreads(), new RelayThreadFactory("log-relay-poller-"));
            ExecutorService fetchExecutor = Executors.newCachedThreadPool(new RelayThreadFactory("log-relay-fetch-"));

            // 2. Remote side
            RemoteLogFetcher source = fetcher != null ? fetcher : OkHttpRemoteLogFetcher.builder()
                .withBaseUrl(config.apiBaseUrl())
                .withAuthToken(config.authToken())
                .withUserAgent("log-relay/" + VERSION)
                .withTimeout(config.apiTimeout())
                .withRetryPolicy(config.retryPolicy())
                .withParser(new RemoteLogResponseParser(
                    mapper, config.messagesField(), RemoteLogResponseParser.DEFAULT_MAX_ENTRY_LENGTH))
                .build();

            // 3. Relay core
            ConnectionRegistry registry = new ConnectionRegistry(wallClock);
            AdmissionLimiter limiter = new AdmissionLimiter(config.admissionPolicy());
            PollingOrchestrator orchestrator = PollingOrchestrator.builder()
                .withFetcher(source)
                .withIndex(new DeduplicationIndex(config.maxMessagesPerBatch()))
                .withSubscribers(registry)
                .withCodec(codec)
                .withScheduler(new ScheduledExecutorScheduler(executor, clock))
                .withFetchExecutor(fetchExecutor)
                .withClock(clock)
                .withWallClock(wallClock)
                .withPolicy(config.pollingPolicy())
                .withObservabilitySink(observabilitySink)
                .build();

            // 4. Session handling
            SubscriptionPipeline pipeline = new SubscriptionPipeline(List.of(
                new KeyValidationStage(validator),
                new AdmissionStage(limiter),
                new RegistrationStage(registry, orchestrator)));
            RelaySessionHandler session = new RelaySessionHandler(
                registry, pipeline, orchestrator, codec, clock, wallClock,
                config.maxMessagesPerBatch(), observabilitySink);

            // 5. Transport
            NettyRelayServer server = NettyRelayServer.builder()
                .withBindAddress(new InetSocketAddress(config.port()))
                .withWebsocketPath(config.websocketPath())
                .withPingInterval(config.pingInterval())
                .withPingTimeout(config.pingTimeout())
                .withAdmissionLimiter(limiter)
                .withClock(clock)
                .withOriginPolicy(config::allowsOrigin)
                .withRoutes(new StatusRoutes(mapper, registry, orchestrator, clock, wallClock,
                    config.environment(), config.websocketPath()))
                .withListener(session)
                .build();

            return new LogRelayRuntime(config, source, registry, orchestrator, server, executor, fetchExecutor);
        }
    }

    private static final class RelayThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        RelayThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
