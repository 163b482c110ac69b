package com.questrail.logrelay.internal.time;

import java.time.Duration;

/**
 * {@link Sleeper} that parks the calling thread.
 */
public enum ThreadSleeper implements Sleeper
{
    INSTANCE;

    @Override
    public void sleep(Duration duration) throws InterruptedException
    {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    }
}
