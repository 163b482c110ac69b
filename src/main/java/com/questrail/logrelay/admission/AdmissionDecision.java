package com.questrail.logrelay.admission;

import com.questrail.logrelay.api.RelayFailure.RateLimitExceeded;

import java.util.Objects;

/**
 * Outcome of {@link AdmissionLimiter#admit(String, long)}.
 */
public sealed interface AdmissionDecision
{
    boolean allowed();

    final class Allowed implements AdmissionDecision
    {
        static final Allowed INSTANCE = new Allowed();

        private Allowed() {
        }

        @Override
        public boolean allowed() {
            return true;
        }

        @Override
        public String toString() {
            return "Allowed";
        }
    }

    record Rejected(RateLimitExceeded failure) implements AdmissionDecision
    {
        public Rejected {
            Objects.requireNonNull(failure, "failure");
        }

        @Override
        public boolean allowed() {
            return false;
        }

        public long retryAfterSeconds() {
            return failure.retryAfterSeconds();
        }
    }
}
