package com.questrail.logrelay.polling;

import java.time.Duration;
import java.util.Objects;

/**
 * PollingPolicy
 * -----------------------------------------------------------------------------
 * Operational cadence for per-key pollers.
 *
 * <ul>
 *   <li><b>interval</b> delay between the end of one tick and the start of the
 *       next. The first tick after activation runs immediately.</li>
 *   <li><b>failureThreshold</b> consecutive failed ticks after which a poller
 *       stops and notifies its subscribers.</li>
 * </ul>
 */
public record PollingPolicy(Duration interval, int failureThreshold)
{
    public PollingPolicy {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
    }

    /**
     * Every 3 seconds; stop after 5 consecutive failures.
     */
    public static PollingPolicy defaults() {
        return new PollingPolicy(Duration.ofSeconds(3), 5);
    }
}
