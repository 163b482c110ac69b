package com.questrail.logrelay.observability;

/**
 * Receives relay observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive concurrently from event-loop and polling threads and
 * must not block.</p>
 */
public interface RelayObservabilitySink {
    /**
     * Called when a key's poller changes phase.
     */
    void onPollerTransition(PollerTransitionEvent event);

    /**
     * Called when a fetch for a key fails after all retries.
     */
    void onFetchFailure(FetchFailureEvent event);

    /**
     * Called on connection lifecycle and subscription changes.
     */
    void onConnectionEvent(ConnectionEvent event);

    /**
     * Called when an unexpected error occurs.
     */
    void onError(RelayErrorEvent event);
}
