package com.questrail.logrelay.fetch;

import java.util.List;
import java.util.Objects;

/**
 * RemoteLog
 * -----------------------------------------------------------------------------
 * Snapshot of a remote append-only sequence from one successful retrieval.
 *
 * <p>{@code length} counts every position in the remote sequence, including
 * positions whose element was dropped as malformed, so the cursor kept by the
 * deduplication index stays aligned with the remote sequence. {@code entries}
 * holds only the valid elements, in ascending position order.</p>
 *
 * <p>{@code shapeRecognized} is {@code false} when the response body did not
 * contain a message array at all; such a snapshot says nothing about the
 * remote length and must not move a cursor.</p>
 */
public record RemoteLog(List<RemoteLogEntry> entries, int length, boolean shapeRecognized)
{
    private static final RemoteLog UNRECOGNIZED = new RemoteLog(List.of(), 0, false);

    public RemoteLog {
        Objects.requireNonNull(entries, "entries");
        entries = List.copyOf(entries);
        if (length < 0) {
            throw new IllegalArgumentException("length must be >= 0");
        }
        if (entries.size() > length) {
            throw new IllegalArgumentException("more entries than positions");
        }
        for (int i = 0; i < entries.size(); i++) {
            int position = entries.get(i).position();
            if (position >= length || (i > 0 && position <= entries.get(i - 1).position())) {
                throw new IllegalArgumentException("entry positions must be ascending and < length");
            }
        }
    }

    public static RemoteLog of(List<RemoteLogEntry> entries, int length) {
        return new RemoteLog(entries, length, true);
    }

    /**
     * Empty snapshot for a response whose shape was not understood.
     */
    public static RemoteLog unrecognized() {
        return UNRECOGNIZED;
    }
}
