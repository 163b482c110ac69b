package com.questrail.logrelay.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Source of elapsed time for poll cadence, backoff and admission windows.
 *
 * <p>Values are only meaningful relative to each other. They never jump with
 * wall-clock adjustments, which is why rate windows and tick deadlines are
 * measured here rather than against {@link WallClock}.</p>
 */
@FunctionalInterface
public interface MonotonicClock
{
    long nowNanos();

    default long nowMillis()
    {
        return nowNanos() / 1_000_000L;
    }
}
