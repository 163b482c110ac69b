package com.questrail.logrelay.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

/**
 * Fetcher whose answers are scripted per call.
 *
 * <p>Queued results are returned in order; once the queue is empty the
 * fallback function answers. Every call is recorded.</p>
 */
public final class ScriptedRemoteLogFetcher implements RemoteLogFetcher {

    private final Deque<Function<String, FetchResult>> script = new ArrayDeque<>();
    private final List<String> calls = new ArrayList<>();
    private Function<String, FetchResult> fallback = key -> FetchResult.success(RemoteLog.of(List.of(), 0));

    @Override
    public FetchResult fetch(String key) {
        Function<String, FetchResult> next;
        synchronized (this) {
            calls.add(key);
            next = script.isEmpty() ? fallback : script.poll();
        }
        return next.apply(key);
    }

    public synchronized ScriptedRemoteLogFetcher thenReturn(FetchResult result) {
        script.add(key -> result);
        return this;
    }

    public synchronized ScriptedRemoteLogFetcher thenAnswer(Function<String, FetchResult> answer) {
        script.add(answer);
        return this;
    }

    public synchronized ScriptedRemoteLogFetcher otherwiseReturn(FetchResult result) {
        this.fallback = key -> result;
        return this;
    }

    public synchronized List<String> calls() {
        return new ArrayList<>(calls);
    }

    public synchronized int callCount() {
        return calls.size();
    }

    /**
     * Successful result whose entries are JSON strings at consecutive positions.
     */
    public static FetchResult logOf(String... values) {
        List<RemoteLogEntry> entries = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            entries.add(new RemoteLogEntry(i, JsonNodeFactory.instance.textNode(values[i])));
        }
        return FetchResult.success(RemoteLog.of(entries, values.length));
    }

    /**
     * Successful result whose entries are the given parsed payloads at
     * consecutive positions.
     */
    public static FetchResult logOfPayloads(JsonNode... payloads) {
        List<RemoteLogEntry> entries = new ArrayList<>();
        for (int i = 0; i < payloads.length; i++) {
            entries.add(new RemoteLogEntry(i, payloads[i]));
        }
        return FetchResult.success(RemoteLog.of(entries, payloads.length));
    }

    public static FetchResult failure() {
        return FetchResult.failure(FetchFailureKind.HTTP_STATUS, "HTTP 503 Service Unavailable");
    }
}
