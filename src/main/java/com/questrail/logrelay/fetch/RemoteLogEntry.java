package com.questrail.logrelay.fetch;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One valid element of a remote log, tagged with its position in the remote
 * sequence.
 */
public record RemoteLogEntry(int position, JsonNode payload)
{
    public RemoteLogEntry {
        if (position < 0) {
            throw new IllegalArgumentException("position must be >= 0");
        }
        Objects.requireNonNull(payload, "payload");
    }
}
