package com.questrail.logrelay.polling;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.logrelay.dedup.DeduplicationIndex;
import com.questrail.logrelay.fetch.FetchResult;
import com.questrail.logrelay.fetch.RemoteLog;
import com.questrail.logrelay.fetch.ScriptedRemoteLogFetcher;
import com.questrail.logrelay.observability.PollerPhase;
import com.questrail.logrelay.observability.PollerTransitionEvent;
import com.questrail.logrelay.observability.RecordingObservabilitySink;
import com.questrail.logrelay.observability.RelayErrorEvent;
import com.questrail.logrelay.protocol.RelayFrameCodec;
import com.questrail.logrelay.registry.ConnectionRegistry;
import com.questrail.logrelay.time.DeterministicScheduler;
import com.questrail.logrelay.time.ManualMonotonicClock;
import com.questrail.logrelay.time.ManualWallClock;
import com.questrail.logrelay.transport.FakeClientEndpoint;
import com.questrail.logrelay.validation.InputValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

import static com.questrail.logrelay.fetch.ScriptedRemoteLogFetcher.failure;
import static com.questrail.logrelay.fetch.ScriptedRemoteLogFetcher.logOf;
import static com.questrail.logrelay.fetch.ScriptedRemoteLogFetcher.logOfPayloads;
import static org.junit.jupiter.api.Assertions.*;

/**
 * PollingOrchestratorTest
 * -----------------------------------------------------------------------------
 * Drives the orchestrator with a deterministic clock and scheduler. Ticks only
 * run inside {@link DeterministicScheduler#runDueTasks()}, so every scenario is
 * fully ordered.
 */
class PollingOrchestratorTest {

    private static final Duration INTERVAL = Duration.ofSeconds(3);
    private static final String KEY = "abc";

    private final ObjectMapper mapper = new ObjectMapper();

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private ScriptedRemoteLogFetcher fetcher;
    private DeduplicationIndex index;
    private ConnectionRegistry registry;
    private RecordingObservabilitySink sink;
    private PollingOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        fetcher = new ScriptedRemoteLogFetcher();
        registry = new ConnectionRegistry(new ManualWallClock());
        sink = new RecordingObservabilitySink();
        orchestrator = buildOrchestrator(DeduplicationIndex.DEFAULT_MAX_BATCH);
    }

    private PollingOrchestrator buildOrchestrator(int maxBatch) {
        return buildOrchestrator(maxBatch, Runnable::run);
    }

    private PollingOrchestrator buildOrchestrator(int maxBatch, Executor fetchExecutor) {
        index = new DeduplicationIndex(maxBatch);
        return PollingOrchestrator.builder()
            .withFetcher(fetcher)
            .withIndex(index)
            .withSubscribers(registry)
            .withCodec(new RelayFrameCodec(mapper, new InputValidator()))
            .withScheduler(scheduler)
            .withFetchExecutor(fetchExecutor)
            .withClock(clock)
            .withWallClock(new ManualWallClock())
            .withPolicy(new PollingPolicy(INTERVAL, 5))
            .withObservabilitySink(sink)
            .build();
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Test
    void firstSubscriberTriggersImmediateFetch() {
        subscribe("c1", KEY);
        assertEquals(0, fetcher.callCount(), "fetch must not run on the subscribing thread");

        scheduler.runDueTasks();

        assertEquals(List.of(KEY), fetcher.calls());
        assertEquals(PollerPhase.ACTIVE, orchestrator.snapshot(KEY).orElseThrow().phase());
    }

    @Test
    void relaysOnlyNewEntriesAcrossTicks() {
        JsonNode id1 = parse("{\"id\":1}");
        JsonNode id2 = parse("{\"id\":2}");
        JsonNode id3 = parse("{\"id\":3}");
        fetcher.thenReturn(logOfPayloads(id1, id2))
            .thenReturn(logOfPayloads(id1, id2))
            .thenReturn(logOfPayloads(id1, id2, id3));
        FakeClientEndpoint client = subscribe("c1", KEY);

        // Tick 1: both entries, cursor 2.
        scheduler.runDueTasks();
        assertEquals(List.of(1, 2), ids(client));
        assertEquals(2, orchestrator.snapshot(KEY).orElseThrow().cursor());

        // Tick 2: remote unchanged, nothing relayed.
        tick();
        assertEquals(List.of(1, 2), ids(client));
        assertEquals(2, orchestrator.snapshot(KEY).orElseThrow().cursor());

        // Tick 3: exactly the third entry.
        tick();
        assertEquals(List.of(1, 2, 3), ids(client));
        assertEquals(id3, events(client, "message").get(2));
        assertEquals(3, orchestrator.snapshot(KEY).orElseThrow().cursor());
    }

    @Test
    void slowFetchDoesNotHoldUpOtherKeys() {
        List<Runnable> fetches = new ArrayList<>();
        orchestrator = buildOrchestrator(DeduplicationIndex.DEFAULT_MAX_BATCH, fetches::add);
        fetcher.otherwiseReturn(logOf("m0"));
        FakeClientEndpoint slow = subscribe("s", "slow");
        FakeClientEndpoint fast = subscribe("f", "fast");

        scheduler.runDueTasks();
        assertEquals(2, fetches.size(), "ticks only dispatch");
        assertEquals(0, fetcher.callCount());

        // The slow key's fetch is still outstanding; the fast key's completes.
        fetches.get(1).run();
        assertEquals(List.of("m0"), messages(fast));
        assertTrue(messages(slow).isEmpty());

        // Next interval: only the fast key is dispatched again.
        tick();
        assertEquals(3, fetches.size());
        assertEquals(List.of("fast"), fetcher.calls());

        fetches.get(0).run();
        assertEquals(List.of("m0"), messages(slow));
    }

    @Test
    void oneFetchPerTickIsSharedByAllSubscribersOfAKey() {
        fetcher.otherwiseReturn(logOf("m0"));
        FakeClientEndpoint a = subscribe("a", KEY);
        FakeClientEndpoint b = subscribe("b", KEY);
        FakeClientEndpoint other = subscribe("c", "other-key");

        scheduler.runDueTasks();

        assertEquals(2, fetcher.callCount(), "one fetch per key");
        assertEquals(List.of("m0"), messages(a));
        assertEquals(List.of("m0"), messages(b));
        assertEquals(List.of("m0"), messages(other));
        assertEquals(1, fetcher.calls().stream().filter(KEY::equals).count());
    }

    @Test
    void secondSubscriberDoesNotStartAnotherPoller() {
        subscribe("a", KEY);
        scheduler.runDueTasks();

        subscribe("b", KEY);
        scheduler.runDueTasks();

        assertEquals(1, fetcher.callCount());
        assertEquals(1, scheduler.pendingCount());
    }

    @Test
    void lastUnsubscribeStopsPollingAndDiscardsCursor() {
        fetcher.otherwiseReturn(logOf("m0", "m1", "m2"));
        FakeClientEndpoint a = subscribe("a", KEY);
        FakeClientEndpoint b = subscribe("b", KEY);
        scheduler.runDueTasks();

        unsubscribe(a);
        assertTrue(orchestrator.snapshot(KEY).isPresent(), "one subscriber still left");

        unsubscribe(b);
        assertTrue(orchestrator.snapshot(KEY).isEmpty());
        assertTrue(index.cursor(KEY).isEmpty());
        assertEquals(0, scheduler.pendingCount());

        int fetches = fetcher.callCount();
        tick();
        tick();
        assertEquals(fetches, fetcher.callCount(), "no fetch after teardown");
    }

    @Test
    void resubscribingAfterTeardownReplaysFromTheStart() {
        fetcher.otherwiseReturn(logOf("m0", "m1", "m2"));
        FakeClientEndpoint first = subscribe("a", KEY);
        scheduler.runDueTasks();
        assertEquals(3, messages(first).size());
        unsubscribe(first);

        FakeClientEndpoint second = subscribe("b", KEY);
        scheduler.runDueTasks();

        assertEquals(List.of("m0", "m1", "m2"), messages(second));
    }

    @Test
    void transitionsAreReported() {
        FakeClientEndpoint client = subscribe("a", KEY);
        unsubscribe(client);

        List<PollerTransitionEvent> transitions = sink.getPollerTransitions();
        assertEquals(2, transitions.size());
        assertEquals(PollerPhase.ABSENT, transitions.get(0).from());
        assertEquals(PollerPhase.ACTIVE, transitions.get(0).to());
        assertEquals(PollerPhase.ACTIVE, transitions.get(1).from());
        assertEquals(PollerPhase.ABSENT, transitions.get(1).to());
    }

    // ---------------------------------------------------------------------
    // Failures
    // ---------------------------------------------------------------------

    @Test
    void thresholdStopsPollerAndNotifiesEachSubscriberOnce() {
        fetcher.otherwiseReturn(failure());
        FakeClientEndpoint a = subscribe("a", KEY);
        FakeClientEndpoint b = subscribe("b", KEY);

        scheduler.runDueTasks();
        for (int i = 0; i < 4; i++) {
            tick();
        }

        assertEquals(5, fetcher.callCount());
        assertEquals(PollerPhase.STOPPED_ON_ERROR, orchestrator.snapshot(KEY).orElseThrow().phase());
        assertEquals(1, events(a, "error").size());
        assertEquals(1, events(b, "error").size());
        assertEquals("Polling stopped after repeated fetch failures",
            events(a, "error").get(0).get("message").asText());

        tick();
        tick();
        assertEquals(5, fetcher.callCount(), "stopped poller must not fetch");
        assertEquals(1, events(a, "error").size());
    }

    @Test
    void successResetsConsecutiveFailures() {
        for (int i = 0; i < 4; i++) {
            fetcher.thenReturn(failure());
        }
        fetcher.thenReturn(logOf());
        for (int i = 0; i < 4; i++) {
            fetcher.thenReturn(failure());
        }
        FakeClientEndpoint client = subscribe("a", KEY);

        scheduler.runDueTasks();
        for (int i = 0; i < 8; i++) {
            tick();
        }

        PollerSnapshot snapshot = orchestrator.snapshot(KEY).orElseThrow();
        assertEquals(PollerPhase.ACTIVE, snapshot.phase());
        assertEquals(4, snapshot.consecutiveFailures());
        assertTrue(events(client, "error").isEmpty());
    }

    @Test
    void unrecognizedResponseShapeCountsAsSuccess() {
        fetcher.thenReturn(failure())
            .thenReturn(FetchResult.success(RemoteLog.unrecognized()));
        FakeClientEndpoint client = subscribe("a", KEY);

        scheduler.runDueTasks();
        tick();

        PollerSnapshot snapshot = orchestrator.snapshot(KEY).orElseThrow();
        assertEquals(0, snapshot.consecutiveFailures());
        assertEquals(0, snapshot.cursor());
        assertTrue(messages(client).isEmpty());
    }

    @Test
    void fetcherExceptionIsReportedAndCountedAsFailure() {
        fetcher.thenAnswer(key -> {
            throw new IllegalStateException("boom");
        });
        subscribe("a", KEY);

        scheduler.runDueTasks();

        assertEquals(1, orchestrator.snapshot(KEY).orElseThrow().consecutiveFailures());
        assertTrue(sink.hasEventOfType(RelayErrorEvent.class));
        assertEquals(1, scheduler.pendingCount(), "next tick still scheduled");
    }

    @Test
    void resubscribingAfterStopRestartsWithFreshState() {
        fetcher.thenReturn(failure()).thenReturn(failure()).thenReturn(failure())
            .thenReturn(failure()).thenReturn(failure())
            .otherwiseReturn(logOf("m0"));
        FakeClientEndpoint stuck = subscribe("a", KEY);
        scheduler.runDueTasks();
        for (int i = 0; i < 4; i++) {
            tick();
        }
        assertEquals(PollerPhase.STOPPED_ON_ERROR, orchestrator.snapshot(KEY).orElseThrow().phase());

        FakeClientEndpoint fresh = subscribe("b", KEY);
        PollerSnapshot restarted = orchestrator.snapshot(KEY).orElseThrow();
        assertEquals(PollerPhase.ACTIVE, restarted.phase());
        assertEquals(0, restarted.consecutiveFailures());
        assertEquals(0, restarted.cursor());

        scheduler.runDueTasks();
        assertEquals(List.of("m0"), messages(fresh));
        assertEquals(List.of("m0"), messages(stuck));
    }

    @Test
    void unsubscribingFromStoppedPollerRemovesIt() {
        fetcher.otherwiseReturn(failure());
        FakeClientEndpoint client = subscribe("a", KEY);
        scheduler.runDueTasks();
        for (int i = 0; i < 4; i++) {
            tick();
        }

        unsubscribe(client);

        assertTrue(orchestrator.snapshot(KEY).isEmpty());
        assertTrue(index.cursor(KEY).isEmpty());
    }

    // ---------------------------------------------------------------------
    // Concurrency edges
    // ---------------------------------------------------------------------

    @Test
    void resultArrivingAfterTeardownIsDiscarded() {
        AtomicReference<FakeClientEndpoint> first = new AtomicReference<>();
        AtomicReference<FakeClientEndpoint> replacement = new AtomicReference<>();
        fetcher.thenAnswer(key -> {
            // Last subscriber leaves and a new one arrives while the fetch is in flight.
            unsubscribe(first.get());
            replacement.set(subscribe("b", KEY));
            return logOf("stale-0", "stale-1", "stale-2");
        }).otherwiseReturn(logOf("x", "y"));
        first.set(subscribe("a", KEY));

        scheduler.runDueTasks();

        assertTrue(messages(first.get()).isEmpty());
        assertEquals(List.of("x", "y"), messages(replacement.get()));
        assertEquals(2, orchestrator.snapshot(KEY).orElseThrow().cursor());
    }

    @Test
    void tickDueWhileFetchInFlightIsDeferred() {
        AtomicReference<FakeClientEndpoint> first = new AtomicReference<>();
        fetcher.thenAnswer(key -> {
            unsubscribe(first.get());
            subscribe("b", KEY);
            // The replacement's immediate tick comes due while this fetch is still running.
            scheduler.runDueTasks();
            return logOf("stale");
        }).otherwiseReturn(logOf("fresh"));
        first.set(subscribe("a", KEY));

        scheduler.runDueTasks();
        assertEquals(1, fetcher.callCount(), "overlapping tick must not fetch");

        tick();
        assertEquals(2, fetcher.callCount());
        FakeClientEndpoint b = (FakeClientEndpoint) registry.subscribersOf(KEY).get(0);
        assertEquals(List.of("fresh"), messages(b));
    }

    // ---------------------------------------------------------------------
    // Delivery
    // ---------------------------------------------------------------------

    @Test
    void shrinkingRemoteLogDeliversNothingAndKeepsCursor() {
        fetcher.thenReturn(logOf("a", "b", "c"))
            .thenReturn(logOf("a"))
            .thenReturn(logOf("a", "b", "c", "d"));
        FakeClientEndpoint client = subscribe("c1", KEY);

        scheduler.runDueTasks();
        tick();
        assertEquals(3, orchestrator.snapshot(KEY).orElseThrow().cursor());

        tick();
        assertEquals(List.of("a", "b", "c", "d"), messages(client));
    }

    @Test
    void batchCapWithholdsRemainderForLaterTicks() {
        orchestrator = buildOrchestrator(2);
        fetcher.otherwiseReturn(logOf("m0", "m1", "m2", "m3", "m4"));
        FakeClientEndpoint client = subscribe("c1", KEY);

        scheduler.runDueTasks();
        assertEquals(List.of("m0", "m1"), messages(client));
        tick();
        assertEquals(List.of("m0", "m1", "m2", "m3"), messages(client));
        tick();
        assertEquals(List.of("m0", "m1", "m2", "m3", "m4"), messages(client));
        tick();
        assertEquals(5, messages(client).size());
    }

    @Test
    void failingSubscriberDoesNotBlockOthers() {
        fetcher.otherwiseReturn(logOf("m0"));
        FakeClientEndpoint broken = subscribe("a", KEY);
        FakeClientEndpoint healthy = subscribe("b", KEY);
        broken.failOnSend(true);

        scheduler.runDueTasks();

        assertEquals(List.of("m0"), messages(healthy));
    }

    @Test
    void shutdownTearsDownAllPollersAndIgnoresLaterSubscriptions() {
        subscribe("a", KEY);
        subscribe("b", "other");

        orchestrator.shutdown();
        assertTrue(orchestrator.snapshots().isEmpty());

        subscribe("c", "third");
        scheduler.runDueTasks();
        assertEquals(0, fetcher.callCount());
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private FakeClientEndpoint subscribe(String id, String key) {
        FakeClientEndpoint endpoint = new FakeClientEndpoint(id);
        registry.connect(endpoint);
        registry.subscribe(id, key);
        orchestrator.onSubscribed(key);
        return endpoint;
    }

    private void unsubscribe(FakeClientEndpoint endpoint) {
        registry.disconnect(endpoint.id()).ifPresent(orchestrator::onUnsubscribed);
    }

    private void tick() {
        clock.advance(INTERVAL);
        scheduler.runDueTasks();
    }

    private List<JsonNode> events(FakeClientEndpoint endpoint, String name) {
        List<JsonNode> result = new ArrayList<>();
        for (String frame : endpoint.sent()) {
            JsonNode node = parse(frame);
            if (name.equals(node.get("event").asText())) {
                result.add(node.get("data"));
            }
        }
        return result;
    }

    private List<String> messages(FakeClientEndpoint endpoint) {
        List<String> result = new ArrayList<>();
        for (JsonNode data : events(endpoint, "message")) {
            result.add(data.asText());
        }
        return result;
    }

    private List<Integer> ids(FakeClientEndpoint endpoint) {
        List<Integer> result = new ArrayList<>();
        for (JsonNode data : events(endpoint, "message")) {
            result.add(data.get("id").asInt());
        }
        return result;
    }

    private JsonNode parse(String frame) {
        try {
            return mapper.readTree(frame);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
