package com.questrail.logrelay.session;

import com.questrail.logrelay.polling.PollingOrchestrator;
import com.questrail.logrelay.registry.ConnectionRegistry;
import com.questrail.logrelay.registry.SubscriptionChange;

import java.util.Objects;

/**
 * Associates the connection with its key. If the connection moves away from
 * another key, that key may lose its last subscriber and its poller is released
 * here. Starting the new key's poller is left to the caller, after the client
 * has been acknowledged.
 */
public final class RegistrationStage implements SubscriptionStage
{
    private final ConnectionRegistry registry;
    private final PollingOrchestrator orchestrator;

    public RegistrationStage(ConnectionRegistry registry, PollingOrchestrator orchestrator)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    }

    @Override
    public String name()
    {
        return "subscribe";
    }

    @Override
    public StageResult apply(SubscriptionRequest request)
    {
        SubscriptionChange change = registry.subscribe(request.connectionId(), request.key());
        if (change.leftPreviousKey()) {
            orchestrator.onUnsubscribed(change.previousKey().get());
        }
        return StageResult.pass();
    }
}
