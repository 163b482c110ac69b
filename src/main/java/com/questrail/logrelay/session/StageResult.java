package com.questrail.logrelay.session;

import com.questrail.logrelay.api.RelayFailure;

import java.util.Objects;

/**
 * Outcome of one {@link SubscriptionStage}.
 */
public sealed interface StageResult
{
    static StageResult pass() {
        return Pass.INSTANCE;
    }

    static StageResult reject(RelayFailure failure) {
        return new Reject(failure);
    }

    final class Pass implements StageResult
    {
        private static final Pass INSTANCE = new Pass();

        private Pass() {
        }

        @Override
        public String toString() {
            return "Pass";
        }
    }

    record Reject(RelayFailure failure) implements StageResult
    {
        public Reject {
            Objects.requireNonNull(failure, "failure");
        }
    }
}
