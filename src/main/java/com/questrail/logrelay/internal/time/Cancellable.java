package com.questrail.logrelay.internal.time;

/**
 * Handle for a scheduled task that may still be withdrawn.
 */
@FunctionalInterface
public interface Cancellable
{
    /**
     * Attempt to cancel the task.
     *
     * @return {@code true} if the task will not run because of this call;
     *         {@code false} if it already ran or was already cancelled
     */
    boolean cancel();
}
