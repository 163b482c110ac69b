package com.questrail.logrelay.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <h2>Worker threads</h2>
 * <p>Poll ticks perform blocking HTTP calls and backoff sleeps, so the executor
 * handed in here should be a dedicated pool and never a Netty event loop.</p>
 *
 * <h2>Executor ownership</h2>
 * <p>This class does not manage the executor's lifecycle. The runtime that
 * created the executor shuts it down.</p>
 *
 * <p>The same {@link MonotonicClock} must be used by callers computing
 * deadlines and by this class converting them to delays.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler
{
    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock)
    {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task)
    {
        Objects.requireNonNull(task, "task");

        // Past deadlines run immediately.
        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }
}
