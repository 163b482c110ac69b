package com.questrail.logrelay.session;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.questrail.logrelay.api.RelayFailure;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionPipelineTest {

    private final List<String> visited = new ArrayList<>();

    @Test
    void runsStagesInOrder() {
        SubscriptionPipeline pipeline = new SubscriptionPipeline(List.of(
            stage("validate", StageResult.pass()),
            stage("rate-limit", StageResult.pass()),
            stage("subscribe", StageResult.pass())));

        StageResult result = pipeline.process(request("abc"));

        assertInstanceOf(StageResult.Pass.class, result);
        assertEquals(List.of("validate", "rate-limit", "subscribe"), visited);
        assertEquals(visited, pipeline.stageNames());
    }

    @Test
    void firstRejectionStopsTheRun() {
        RelayFailure failure = new RelayFailure.ValidationError("Key contains invalid characters");
        SubscriptionPipeline pipeline = new SubscriptionPipeline(List.of(
            stage("validate", StageResult.reject(failure)),
            stage("rate-limit", StageResult.pass())));

        StageResult result = pipeline.process(request("a b"));

        assertEquals(new StageResult.Reject(failure), result);
        assertEquals(List.of("validate"), visited);
    }

    @Test
    void emptyPipelineIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SubscriptionPipeline(List.of()));
    }

    private SubscriptionStage stage(String name, StageResult outcome) {
        return new SubscriptionStage() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public StageResult apply(SubscriptionRequest request) {
                visited.add(name);
                return outcome;
            }
        };
    }

    private static SubscriptionRequest request(String key) {
        return new SubscriptionRequest("c1", "10.0.0.1", key, JsonNodeFactory.instance.objectNode(), 0);
    }
}
