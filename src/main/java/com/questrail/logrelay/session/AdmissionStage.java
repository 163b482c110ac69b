package com.questrail.logrelay.session;

import com.questrail.logrelay.admission.AdmissionDecision;
import com.questrail.logrelay.admission.AdmissionLimiter;

import java.util.Objects;

/**
 * Counts the request against its origin's rate window.
 */
public final class AdmissionStage implements SubscriptionStage
{
    private final AdmissionLimiter limiter;

    public AdmissionStage(AdmissionLimiter limiter)
    {
        this.limiter = Objects.requireNonNull(limiter, "limiter");
    }

    @Override
    public String name()
    {
        return "rate-limit";
    }

    @Override
    public StageResult apply(SubscriptionRequest request)
    {
        AdmissionDecision decision = limiter.admit(request.origin(), request.nowMillis());
        if (decision instanceof AdmissionDecision.Rejected rejected) {
            return StageResult.reject(rejected.failure());
        }
        return StageResult.pass();
    }
}
