package com.questrail.logrelay.session;

import com.questrail.logrelay.validation.InputValidator;

import java.util.Objects;

/**
 * Rejects malformed keys before anything is counted or registered.
 */
public final class KeyValidationStage implements SubscriptionStage
{
    private final InputValidator validator;

    public KeyValidationStage(InputValidator validator)
    {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    @Override
    public String name()
    {
        return "validate";
    }

    @Override
    public StageResult apply(SubscriptionRequest request)
    {
        return validator.validateKey(request.key())
                .<StageResult>map(StageResult::reject)
                .orElseGet(StageResult::pass);
    }
}
