package com.questrail.logrelay.fetch;

import java.util.Objects;

/**
 * FetchResult
 * =============================================================================
 * Uniform outcome of {@link RemoteLogFetcher#fetch(String)}.
 *
 * <p>Transient errors never cross the fetch boundary as exceptions; they are
 * returned as a {@link Failure} carrying the last attempt's classification.</p>
 */
public sealed interface FetchResult
{
    boolean isSuccess();

    static FetchResult success(RemoteLog log) {
        return new Success(log);
    }

    static FetchResult failure(FetchFailureKind kind, String message) {
        return new Failure(new FetchFailure(kind, message));
    }

    record Success(RemoteLog log) implements FetchResult
    {
        public Success {
            Objects.requireNonNull(log, "log");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure(FetchFailure failure) implements FetchResult
    {
        public Failure {
            Objects.requireNonNull(failure, "failure");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
