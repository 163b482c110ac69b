package com.questrail.logrelay.internal.time;

import java.time.Instant;

/**
 * Wall-clock time for timestamps shown to clients and operators.
 *
 * <p>Never used for scheduling; see {@link MonotonicScheduler}.</p>
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();
}
