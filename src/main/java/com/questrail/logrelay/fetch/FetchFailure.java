package com.questrail.logrelay.fetch;

import java.util.Objects;

public record FetchFailure(FetchFailureKind kind, String message)
{
    public FetchFailure {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
