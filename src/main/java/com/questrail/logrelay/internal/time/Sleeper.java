package com.questrail.logrelay.internal.time;

import java.time.Duration;

/**
 * Blocking pause between fetch attempts.
 *
 * <p>Retry backoff goes through this seam so tests can record the requested
 * delays instead of waiting for them.</p>
 */
@FunctionalInterface
public interface Sleeper
{
    void sleep(Duration duration) throws InterruptedException;
}
