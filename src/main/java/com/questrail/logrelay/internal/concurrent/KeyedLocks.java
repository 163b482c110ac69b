package com.questrail.logrelay.internal.concurrent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * KeyedLocks
 * -----------------------------------------------------------------------------
 * Striped mutual exclusion keyed by a subscription key.
 *
 * <p>Two equal keys always map to the same lock, so all state changes for one
 * key are serialized. Distinct keys usually map to distinct stripes and proceed
 * in parallel; a hash collision only costs contention, never correctness.</p>
 *
 * <p>Locks are reentrant, so an operation holding a key's lock may call into
 * another operation that takes the same lock.</p>
 */
public final class KeyedLocks
{
    public static final int DEFAULT_STRIPES = 64;

    private final List<ReentrantLock> stripes;

    public KeyedLocks()
    {
        this(DEFAULT_STRIPES);
    }

    public KeyedLocks(int stripeCount)
    {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("stripeCount must be >= 1");
        }
        this.stripes = new ArrayList<>(stripeCount);
        for (int i = 0; i < stripeCount; i++) {
            stripes.add(new ReentrantLock());
        }
    }

    public ReentrantLock lockFor(String key)
    {
        Objects.requireNonNull(key, "key");
        return stripes.get(Math.floorMod(key.hashCode(), stripes.size()));
    }

    /**
     * Run {@code action} while holding the lock for {@code key}.
     */
    public void runLocked(String key, Runnable action)
    {
        supplyLocked(key, () -> {
            action.run();
            return null;
        });
    }

    public <T> T supplyLocked(String key, Supplier<T> action)
    {
        Objects.requireNonNull(action, "action");
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
