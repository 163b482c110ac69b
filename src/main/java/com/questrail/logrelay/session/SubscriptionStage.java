package com.questrail.logrelay.session;

/**
 * One named step of the {@link SubscriptionPipeline}.
 */
public interface SubscriptionStage
{
    String name();

    StageResult apply(SubscriptionRequest request);
}
