package com.questrail.logrelay.polling;

import com.questrail.logrelay.api.RelayEvent;
import com.questrail.logrelay.api.RelayFailure.PollingThresholdExceeded;
import com.questrail.logrelay.dedup.DeduplicationIndex;
import com.questrail.logrelay.fetch.FetchFailure;
import com.questrail.logrelay.fetch.FetchFailureKind;
import com.questrail.logrelay.fetch.FetchResult;
import com.questrail.logrelay.fetch.RemoteLogEntry;
import com.questrail.logrelay.fetch.RemoteLogFetcher;
import com.questrail.logrelay.internal.concurrent.KeyedLocks;
import com.questrail.logrelay.internal.time.MonotonicClock;
import com.questrail.logrelay.internal.time.MonotonicScheduler;
import com.questrail.logrelay.internal.time.WallClock;
import com.questrail.logrelay.observability.FetchFailureEvent;
import com.questrail.logrelay.observability.NullObservabilitySink;
import com.questrail.logrelay.observability.PollerPhase;
import com.questrail.logrelay.observability.PollerTransitionEvent;
import com.questrail.logrelay.observability.RelayErrorEvent;
import com.questrail.logrelay.observability.RelayObservabilitySink;
import com.questrail.logrelay.protocol.RelayFrameCodec;
import com.questrail.logrelay.registry.SubscriberDirectory;
import com.questrail.logrelay.transport.ClientEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * PollingOrchestrator
 * =============================================================================
 * Owns one poller per subscribed key and relays what it finds.
 *
 * <h2>Lifecycle per key</h2>
 * <pre>
 *   ABSENT --first subscriber--> ACTIVE --last subscriber leaves--> ABSENT
 *                                  |
 *                                  +--threshold consecutive failures--> STOPPED_ON_ERROR
 *   STOPPED_ON_ERROR --re-subscribe--> ACTIVE (fresh state, cursor 0)
 *   STOPPED_ON_ERROR --last subscriber leaves--> ABSENT
 * </pre>
 * The subscriber count is never tracked here: every lifecycle decision re-reads
 * it from the {@link SubscriberDirectory} while holding the key's lock.
 *
 * <h2>Ticks</h2>
 * <ol>
 *   <li>Activation schedules an immediate tick.</li>
 *   <li>A tick fetches without holding any lock, then takes the key's lock to
 *       apply the result. A result for a poller that was torn down or replaced
 *       meanwhile is discarded.</li>
 *   <li>Success resets the failure counter, advances the deduplication cursor
 *       and sends each new entry, in order, to every subscriber of the key.</li>
 *   <li>Failure increments the counter. Reaching the threshold stops the poller
 *       and sends exactly one error event to each current subscriber.</li>
 *   <li>An active poller schedules its next tick one interval after the current
 *       one completes.</li>
 * </ol>
 * At most one fetch per key is in flight. A tick that finds its key busy is
 * pushed back by one interval.
 *
 * <h2>Threading</h2>
 * {@link #onSubscribed(String)} and {@link #onUnsubscribed(String)} are cheap
 * and never block on I/O; they are safe to call from network event loops.
 * Scheduler threads only dispatch ticks. Each fetch, including its retries,
 * runs on the fetch {@link Executor}, so a slow key holds a fetch thread and
 * never a scheduler thread. The default executor runs the fetch inline.
 */
public final class PollingOrchestrator
{
    private static final Logger log = LoggerFactory.getLogger(PollingOrchestrator.class);

    private final RemoteLogFetcher fetcher;
    private final DeduplicationIndex index;
    private final SubscriberDirectory subscribers;
    private final RelayFrameCodec codec;
    private final MonotonicScheduler scheduler;
    private final Executor fetchExecutor;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final PollingPolicy policy;
    private final RelayObservabilitySink sink;

    private final KeyedLocks locks = new KeyedLocks();
    private final ConcurrentMap<String, PollerState> pollers = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    private volatile boolean shutdown;

    private PollingOrchestrator(Builder b)
    {
        this.fetcher = Objects.requireNonNull(b.fetcher, "fetcher");
        this.index = Objects.requireNonNull(b.index, "index");
        this.subscribers = Objects.requireNonNull(b.subscribers, "subscribers");
        this.codec = Objects.requireNonNull(b.codec, "codec");
        this.scheduler = Objects.requireNonNull(b.scheduler, "scheduler");
        this.fetchExecutor = Objects.requireNonNull(b.fetchExecutor, "fetchExecutor");
        this.clock = Objects.requireNonNull(b.clock, "clock");
        this.wallClock = Objects.requireNonNull(b.wallClock, "wallClock");
        this.policy = Objects.requireNonNull(b.policy, "policy");
        this.sink = Objects.requireNonNull(b.observabilitySink, "observabilitySink");
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public PollingPolicy policy()
    {
        return policy;
    }

    /**
     * A connection subscribed to {@code key}. Starts the key's poller if none
     * is running, or restarts one that stopped on errors.
     */
    public void onSubscribed(String key)
    {
        Objects.requireNonNull(key, "key");
        locks.runLocked(key, () -> {
            if (shutdown || subscribers.subscriberCount(key) == 0) {
                return;
            }
            PollerState current = pollers.get(key);
            if (current == null) {
                activate(key, PollerPhase.ABSENT, "first subscriber");
            }
            else if (current.phase() == PollerPhase.STOPPED_ON_ERROR) {
                retire(current);
                activate(key, PollerPhase.STOPPED_ON_ERROR, "re-subscribed after failure");
            }
        });
    }

    /**
     * A connection left {@code key}. Tears the poller down and forgets the
     * key's cursor once no subscriber is left.
     */
    public void onUnsubscribed(String key)
    {
        Objects.requireNonNull(key, "key");
        locks.runLocked(key, () -> {
            if (subscribers.subscriberCount(key) > 0) {
                return;
            }
            PollerState state = pollers.get(key);
            if (state != null) {
                PollerPhase from = state.phase();
                retire(state);
                transition(key, from, PollerPhase.ABSENT, "last subscriber left");
            }
        });
    }

    public Optional<PollerSnapshot> snapshot(String key)
    {
        return locks.supplyLocked(key, () -> {
            PollerState state = pollers.get(key);
            return state == null ? Optional.<PollerSnapshot>empty() : Optional.of(snapshotOf(state));
        });
    }

    /**
     * Snapshots of all pollers, sorted by key.
     */
    public List<PollerSnapshot> snapshots()
    {
        List<PollerSnapshot> result = new ArrayList<>();
        for (String key : new TreeSet<>(pollers.keySet())) {
            snapshot(key).ifPresent(result::add);
        }
        return result;
    }

    public int activePollerCount()
    {
        int count = 0;
        for (PollerState state : pollers.values()) {
            if (state.phase() == PollerPhase.ACTIVE) {
                count++;
            }
        }
        return count;
    }

    /**
     * Tear every poller down. Later subscriptions are ignored.
     */
    public void shutdown()
    {
        shutdown = true;
        for (String key : new ArrayList<>(pollers.keySet())) {
            locks.runLocked(key, () -> {
                PollerState state = pollers.get(key);
                if (state != null) {
                    PollerPhase from = state.phase();
                    retire(state);
                    transition(key, from, PollerPhase.ABSENT, "shutdown");
                }
            });
        }
    }

    // Caller holds the key's lock.
    private void activate(String key, PollerPhase from, String reason)
    {
        index.open(key);
        PollerState state = new PollerState(key, wallClock.now());
        pollers.put(key, state);
        transition(key, from, PollerPhase.ACTIVE, reason);
        state.setPendingTick(scheduler.scheduleAtNanos(clock.nowNanos(), () -> runTick(state)));
    }

    // Caller holds the key's lock.
    private void retire(PollerState state)
    {
        state.deactivate();
        pollers.remove(state.key(), state);
        index.discard(state.key());
    }

    private void runTick(PollerState state)
    {
        String key = state.key();
        if (!state.isActive()) {
            return;
        }
        if (!inFlight.add(key)) {
            log.debug("Tick for key {} deferred; previous fetch still in flight", key);
            locks.runLocked(key, () -> {
                if (isPolling(state)) {
                    scheduleNext(state);
                }
            });
            return;
        }

        try {
            fetchExecutor.execute(() -> fetchAndComplete(state));
        } catch (RejectedExecutionException e) {
            inFlight.remove(key);
            log.debug("Fetch for key {} rejected; executor is shutting down", key);
        }
    }

    private void fetchAndComplete(PollerState state)
    {
        String key = state.key();
        try {
            FetchResult result = fetchGuarded(key);
            locks.runLocked(key, () -> complete(state, result));
        } catch (RuntimeException e) {
            sink.onError(new RelayErrorEvent(wallClock.now(), "Tick failed for key " + key, e));
            locks.runLocked(key, () -> {
                if (isPolling(state)) {
                    scheduleNext(state);
                }
            });
        } finally {
            inFlight.remove(key);
        }
    }

    private FetchResult fetchGuarded(String key)
    {
        try {
            return fetcher.fetch(key);
        } catch (RuntimeException e) {
            sink.onError(new RelayErrorEvent(wallClock.now(), "Fetcher threw for key " + key, e));
            return FetchResult.failure(FetchFailureKind.UNKNOWN, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    // Caller holds the key's lock.
    private void complete(PollerState state, FetchResult result)
    {
        String key = state.key();
        if (!isPolling(state)) {
            log.debug("Discarding fetch result for key {}; poller no longer current", key);
            return;
        }

        state.recordPoll(wallClock.now());

        if (result instanceof FetchResult.Success success) {
            state.recordSuccess();
            deliver(key, index.advance(key, success.log()));
        }
        else {
            FetchFailure failure = ((FetchResult.Failure) result).failure();
            int failures = state.recordFailure(failure);
            sink.onFetchFailure(new FetchFailureEvent(wallClock.now(), key, failure, failures));
            if (failures >= policy.failureThreshold()) {
                stopOnError(state, failure, failures);
                return;
            }
        }

        scheduleNext(state);
    }

    // Caller holds the key's lock.
    private void stopOnError(PollerState state, FetchFailure failure, int failures)
    {
        String key = state.key();
        state.stop();
        transition(key, PollerPhase.ACTIVE, PollerPhase.STOPPED_ON_ERROR,
                failures + " consecutive failures, last: " + failure);

        RelayEvent.Error error = RelayEvent.Error.of(
                new PollingThresholdExceeded(key, failures, failure.toString()), wallClock.now());
        broadcast(key, codec.encode(error));
    }

    private void deliver(String key, List<RemoteLogEntry> entries)
    {
        if (entries.isEmpty()) {
            return;
        }
        log.debug("Relaying {} new entries for key {}", entries.size(), key);
        for (RemoteLogEntry entry : entries) {
            broadcast(key, codec.encode(new RelayEvent.Message(entry.payload())));
        }
    }

    private void broadcast(String key, String frame)
    {
        for (ClientEndpoint endpoint : subscribers.subscribersOf(key)) {
            try {
                endpoint.sendText(frame);
            } catch (RuntimeException e) {
                log.warn("Failed to send to connection {} for key {}", endpoint.id(), key, e);
            }
        }
    }

    private void scheduleNext(PollerState state)
    {
        state.setPendingTick(scheduler.scheduleAfter(policy.interval(), clock, () -> runTick(state)));
    }

    private boolean isPolling(PollerState state)
    {
        return state.isActive()
                && state.phase() == PollerPhase.ACTIVE
                && pollers.get(state.key()) == state;
    }

    private PollerSnapshot snapshotOf(PollerState state)
    {
        return state.snapshot(index.cursor(state.key()).orElse(0));
    }

    private void transition(String key, PollerPhase from, PollerPhase to, String reason)
    {
        sink.onPollerTransition(new PollerTransitionEvent(wallClock.now(), key, from, to, reason));
    }

    public static final class Builder
    {
        private RemoteLogFetcher fetcher;
        private DeduplicationIndex index;
        private SubscriberDirectory subscribers;
        private RelayFrameCodec codec;
        private MonotonicScheduler scheduler;
        private Executor fetchExecutor = Runnable::run;
        private MonotonicClock clock;
        private WallClock wallClock;
        private PollingPolicy policy = PollingPolicy.defaults();
        private RelayObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withFetcher(RemoteLogFetcher fetcher) {
            this.fetcher = fetcher;
            return this;
        }

        public Builder withIndex(DeduplicationIndex index) {
            this.index = index;
            return this;
        }

        public Builder withSubscribers(SubscriberDirectory subscribers) {
            this.subscribers = subscribers;
            return this;
        }

        public Builder withCodec(RelayFrameCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Executor for the blocking fetch of each tick. Defaults to running it
         * on the scheduler thread.
         */
        public Builder withFetchExecutor(Executor fetchExecutor) {
            this.fetchExecutor = fetchExecutor;
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

        public Builder withPolicy(PollingPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder withObservabilitySink(RelayObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public PollingOrchestrator build() {
            return new PollingOrchestrator(this);
        }
    }
}
