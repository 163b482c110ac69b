package com.questrail.logrelay.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RelayObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jRelayObservabilitySink implements RelayObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRelayObservabilitySink.class);

    @Override
    public void onPollerTransition(PollerTransitionEvent event) {
        if (event.to() == PollerPhase.STOPPED_ON_ERROR) {
            log.warn("Poller {}: {} -> {} ({})", event.key(), event.from(), event.to(), event.reason());
        } else {
            log.info("Poller {}: {} -> {} ({})", event.key(), event.from(), event.to(), event.reason());
        }
    }

    @Override
    public void onFetchFailure(FetchFailureEvent event) {
        log.warn("Fetch failed for key {} ({} consecutive): {}",
            event.key(), event.consecutiveFailures(), event.failure());
    }

    @Override
    public void onConnectionEvent(ConnectionEvent event) {
        String context = event.context().isEmpty() ? "" : " context=" + event.context();
        if (event.kind() == ConnectionEvent.Kind.REJECTED) {
            log.warn("Connection {} from {}: {}{}", event.connectionId(), event.origin(), event.kind(), context);
        } else {
            log.info("Connection {} from {}: {}{}{}", event.connectionId(), event.origin(), event.kind(),
                event.key().map(k -> " key=" + k).orElse(""), context);
        }
    }

    @Override
    public void onError(RelayErrorEvent event) {
        log.error("Relay error: {}", event.message(), event.cause());
    }
}
