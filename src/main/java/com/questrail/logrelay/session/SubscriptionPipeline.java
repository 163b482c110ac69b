package com.questrail.logrelay.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * SubscriptionPipeline
 * =============================================================================
 * Ordered, named stages every subscription request passes through.
 *
 * <p>The production order is {@code validate -> rate-limit -> subscribe}: a
 * malformed key is rejected without consuming the origin's allowance, and
 * nothing is registered for a request that was throttled. The first rejecting
 * stage ends the run.</p>
 */
public final class SubscriptionPipeline
{
    private static final Logger log = LoggerFactory.getLogger(SubscriptionPipeline.class);

    private final List<SubscriptionStage> stages;

    public SubscriptionPipeline(List<SubscriptionStage> stages)
    {
        Objects.requireNonNull(stages, "stages");
        if (stages.isEmpty()) {
            throw new IllegalArgumentException("pipeline needs at least one stage");
        }
        this.stages = List.copyOf(stages);
    }

    public List<String> stageNames()
    {
        return stages.stream().map(SubscriptionStage::name).collect(Collectors.toList());
    }

    public StageResult process(SubscriptionRequest request)
    {
        Objects.requireNonNull(request, "request");
        for (SubscriptionStage stage : stages) {
            StageResult result = stage.apply(request);
            if (result instanceof StageResult.Reject reject) {
                log.debug("Subscription of {} to '{}' rejected at stage {}: {}",
                        request.connectionId(), request.key(), stage.name(), reject.failure().message());
                return result;
            }
        }
        return StageResult.pass();
    }
}
