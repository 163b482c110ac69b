package com.questrail.logrelay.fetch;

/**
 * Port to the remote message source.
 *
 * <p>Implementations block the calling thread for the full retry sequence and
 * must never be invoked from a network event loop.</p>
 */
public interface RemoteLogFetcher
{
    /**
     * Retrieve the full remote log for {@code key}, retrying transient failures.
     */
    FetchResult fetch(String key);
}
