package com.questrail.logrelay.registry;

import java.util.Objects;
import java.util.Optional;

/**
 * Effect of {@link ConnectionRegistry#subscribe(String, String)}.
 *
 * @param previousKey      the key the connection held before, if any
 * @param previousKeyCount subscribers left on {@code previousKey} afterwards;
 *                         0 when there was no previous key
 * @param key              the key now held
 * @param keyCount         subscribers on {@code key} afterwards
 */
public record SubscriptionChange(Optional<String> previousKey, int previousKeyCount, String key, int keyCount)
{
    public SubscriptionChange {
        Objects.requireNonNull(previousKey, "previousKey");
        Objects.requireNonNull(key, "key");
    }

    /**
     * {@code true} if the connection moved away from a different key.
     */
    public boolean leftPreviousKey() {
        return previousKey.isPresent() && !previousKey.get().equals(key);
    }

    /**
     * {@code true} if this call made the connection a new subscriber of {@code key}.
     */
    public boolean joinedKey() {
        return previousKey.isEmpty() || !previousKey.get().equals(key);
    }
}
