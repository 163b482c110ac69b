package com.questrail.logrelay.polling;

import com.questrail.logrelay.fetch.FetchFailure;
import com.questrail.logrelay.internal.time.Cancellable;
import com.questrail.logrelay.observability.PollerPhase;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable per-key poller state.
 *
 * <p>Mutated only while the key's lock is held. {@link #isActive()} is also read
 * without the lock, at the start of a tick, to skip ticks of a poller that is
 * already gone.</p>
 */
final class PollerState
{
    private final String key;
    private final Instant createdAt;

    private volatile boolean active = true;
    private volatile PollerPhase phase = PollerPhase.ACTIVE;
    private int consecutiveFailures;
    private Instant lastPollAt;
    private FetchFailure lastFailure;
    private Cancellable pendingTick;

    PollerState(String key, Instant createdAt)
    {
        this.key = Objects.requireNonNull(key, "key");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    String key()
    {
        return key;
    }

    boolean isActive()
    {
        return active;
    }

    PollerPhase phase()
    {
        return phase;
    }

    int consecutiveFailures()
    {
        return consecutiveFailures;
    }

    void setPendingTick(Cancellable tick)
    {
        this.pendingTick = tick;
    }

    void recordPoll(Instant at)
    {
        this.lastPollAt = at;
    }

    void recordSuccess()
    {
        consecutiveFailures = 0;
    }

    /**
     * @return the consecutive failure count including this one
     */
    int recordFailure(FetchFailure failure)
    {
        lastFailure = failure;
        return ++consecutiveFailures;
    }

    /**
     * Stop ticking but keep the state around until subscribers leave or re-subscribe.
     */
    void stop()
    {
        phase = PollerPhase.STOPPED_ON_ERROR;
        cancelPendingTick();
    }

    /**
     * Permanently retire this state. Any tick still running will see it as stale.
     */
    void deactivate()
    {
        active = false;
        cancelPendingTick();
    }

    PollerSnapshot snapshot(int cursor)
    {
        return new PollerSnapshot(key, phase, cursor, consecutiveFailures, createdAt,
                Optional.ofNullable(lastPollAt), Optional.ofNullable(lastFailure));
    }

    private void cancelPendingTick()
    {
        Cancellable tick = pendingTick;
        pendingTick = null;
        if (tick != null) {
            tick.cancel();
        }
    }
}
