package com.questrail.logrelay.config;

import java.util.List;

/**
 * Configuration could not be loaded. Lists every problem found, not just the first.
 */
public final class RelayConfigException extends RuntimeException
{
    private final List<String> problems;

    public RelayConfigException(List<String> problems)
    {
        super("Invalid configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems()
    {
        return problems;
    }
}
