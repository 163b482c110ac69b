package com.questrail.logrelay.dedup;

import com.questrail.logrelay.fetch.RemoteLog;
import com.questrail.logrelay.fetch.RemoteLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * DeduplicationIndex
 * =============================================================================
 * Per-key cursor over a remote append-only log.
 *
 * <p>The cursor {@code c} of a key counts the remote positions already consumed.
 * Given a fresh snapshot of length {@code L}, {@link #advance(String, RemoteLog)}
 * consumes positions {@code [c, min(L, c + maxBatch))}, returns the valid
 * entries among them in position order, and moves the cursor to the end of that
 * range. Positions past the batch cap stay unconsumed and come out on a later
 * call.</p>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>A cursor never decreases while its key stays open.</li>
 *   <li>No position is returned twice for one opening of a key.</li>
 *   <li>If the remote sequence got shorter ({@code L < c}) nothing is returned
 *       and the cursor is left as is; the anomaly is logged.</li>
 * </ul>
 *
 * <h2>Concurrency</h2>
 * Cursor reads and writes are atomic per key. The polling orchestrator is the
 * only writer and serializes calls per key; this class does not order
 * concurrent {@code advance} calls for the same key against each other.
 */
public final class DeduplicationIndex
{
    private static final Logger log = LoggerFactory.getLogger(DeduplicationIndex.class);

    public static final int DEFAULT_MAX_BATCH = 100;

    private final int maxBatch;
    private final ConcurrentMap<String, Integer> cursors = new ConcurrentHashMap<>();

    public DeduplicationIndex()
    {
        this(DEFAULT_MAX_BATCH);
    }

    public DeduplicationIndex(int maxBatch)
    {
        if (maxBatch < 1) {
            throw new IllegalArgumentException("maxBatch must be >= 1");
        }
        this.maxBatch = maxBatch;
    }

    /**
     * Start tracking {@code key} from position 0. Re-opening resets the cursor.
     */
    public void open(String key)
    {
        cursors.put(Objects.requireNonNull(key, "key"), 0);
    }

    /**
     * Forget {@code key}. A later {@link #open(String)} replays from position 0.
     */
    public void discard(String key)
    {
        cursors.remove(Objects.requireNonNull(key, "key"));
    }

    public OptionalInt cursor(String key)
    {
        Integer c = cursors.get(key);
        return c == null ? OptionalInt.empty() : OptionalInt.of(c);
    }

    public boolean isOpen(String key)
    {
        return cursors.containsKey(key);
    }

    public int maxBatch()
    {
        return maxBatch;
    }

    /**
     * Consume the next window of {@code snapshot} for {@code key}.
     *
     * @return new entries in remote order; empty for an unknown key, an
     *         unrecognized snapshot, or a shrunken remote sequence
     */
    public List<RemoteLogEntry> advance(String key, RemoteLog snapshot)
    {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(snapshot, "snapshot");

        Integer current = cursors.get(key);
        if (current == null || !snapshot.shapeRecognized()) {
            return List.of();
        }

        int cursor = current;
        int length = snapshot.length();
        if (length < cursor) {
            log.warn("Remote log for key {} shrank from {} to {} entries; cursor kept at {}",
                    key, cursor, length, cursor);
            return List.of();
        }

        int end = (int) Math.min(length, (long) cursor + maxBatch);
        if (end == cursor) {
            return List.of();
        }

        List<RemoteLogEntry> fresh = new ArrayList<>();
        for (RemoteLogEntry entry : snapshot.entries()) {
            if (entry.position() >= end) {
                break;
            }
            if (entry.position() >= cursor) {
                fresh.add(entry);
            }
        }

        // Only move forward, and only if the key was not discarded meanwhile.
        cursors.computeIfPresent(key, (k, c) -> Math.max(c, end));

        if (end < length) {
            log.debug("Key {}: delivered positions [{}, {}); {} withheld for later ticks",
                    key, cursor, end, length - end);
        }
        return fresh;
    }

    /**
     * Number of keys currently tracked.
     */
    public int size()
    {
        return cursors.size();
    }
}
