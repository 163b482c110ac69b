package com.questrail.logrelay.observability;

/**
 * No-op implementation of RelayObservabilitySink.
 */
public final class NullObservabilitySink implements RelayObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onPollerTransition(PollerTransitionEvent event) {}

    @Override
    public void onFetchFailure(FetchFailureEvent event) {}

    @Override
    public void onConnectionEvent(ConnectionEvent event) {}

    @Override
    public void onError(RelayErrorEvent event) {}
}
