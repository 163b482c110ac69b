package com.questrail.logrelay.session;

import com.questrail.logrelay.api.ClientCommand;
import com.questrail.logrelay.api.RelayEvent;
import com.questrail.logrelay.internal.time.MonotonicClock;
import com.questrail.logrelay.internal.time.WallClock;
import com.questrail.logrelay.observability.ConnectionEvent;
import com.questrail.logrelay.observability.NullObservabilitySink;
import com.questrail.logrelay.observability.RelayErrorEvent;
import com.questrail.logrelay.observability.RelayObservabilitySink;
import com.questrail.logrelay.polling.PollingOrchestrator;
import com.questrail.logrelay.protocol.RelayDecodeException;
import com.questrail.logrelay.protocol.RelayFrameCodec;
import com.questrail.logrelay.registry.ConnectionRegistry;
import com.questrail.logrelay.transport.ClientEndpoint;
import com.questrail.logrelay.transport.RelayTransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * RelaySessionHandler
 * =============================================================================
 * Translates transport callbacks into registry, pipeline and orchestrator calls.
 *
 * <h2>Protocol</h2>
 * <ul>
 *   <li>open: register the connection and send {@code connected}</li>
 *   <li>{@code subscribe} / {@code startPolling}: run the subscription pipeline,
 *       answer {@code subscribed} or {@code error}</li>
 *   <li>{@code ping}: answer {@code pong}</li>
 *   <li>close: drop the connection; its key may lose its last subscriber</li>
 * </ul>
 *
 * <p>Nothing here blocks, so all callbacks run directly on the transport's
 * threads.</p>
 */
public final class RelaySessionHandler implements RelayTransportListener
{
    private static final Logger log = LoggerFactory.getLogger(RelaySessionHandler.class);

    private final ConnectionRegistry registry;
    private final SubscriptionPipeline pipeline;
    private final PollingOrchestrator orchestrator;
    private final RelayFrameCodec codec;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final int maxMessagesPerBatch;
    private final RelayObservabilitySink sink;

    public RelaySessionHandler(
            ConnectionRegistry registry,
            SubscriptionPipeline pipeline,
            PollingOrchestrator orchestrator,
            RelayFrameCodec codec,
            MonotonicClock clock,
            WallClock wallClock,
            int maxMessagesPerBatch,
            RelayObservabilitySink sink)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.maxMessagesPerBatch = maxMessagesPerBatch;
        this.sink = sink == null ? NullObservabilitySink.INSTANCE : sink;
    }

    @Override
    public void onOpen(ClientEndpoint endpoint)
    {
        registry.connect(endpoint);
        connectionEvent(ConnectionEvent.Kind.CONNECTED, endpoint, Optional.empty());
        send(endpoint, new RelayEvent.Connected(
                endpoint.id(), wallClock.now(), orchestrator.policy().interval(), maxMessagesPerBatch));
    }

    @Override
    public void onText(ClientEndpoint endpoint, String frame)
    {
        registry.touch(endpoint.id());

        ClientCommand command;
        try {
            command = codec.decode(frame);
        } catch (RelayDecodeException e) {
            log.debug("Undecodable frame from {}: {}", endpoint.id(), e.getMessage());
            send(endpoint, RelayEvent.Error.of("Invalid payload: expected a JSON object with an event name",
                    wallClock.now()));
            return;
        }

        try {
            if (command instanceof ClientCommand.Subscribe subscribe) {
                handleSubscribe(endpoint, subscribe);
            }
            else if (command instanceof ClientCommand.Ping) {
                send(endpoint, new RelayEvent.Pong(wallClock.now().toEpochMilli()));
            }
            else if (command instanceof ClientCommand.Unsupported unsupported) {
                send(endpoint, RelayEvent.Error.of("Unsupported event: " + unsupported.event(), wallClock.now()));
            }
        } catch (RuntimeException e) {
            sink.onError(new RelayErrorEvent(wallClock.now(),
                    "Failed to handle frame from connection " + endpoint.id(), e));
            send(endpoint, RelayEvent.Error.of("Internal error", wallClock.now()));
        }
    }

    @Override
    public void onClose(ClientEndpoint endpoint)
    {
        Optional<String> key = registry.disconnect(endpoint.id());
        key.ifPresent(orchestrator::onUnsubscribed);
        connectionEvent(ConnectionEvent.Kind.DISCONNECTED, endpoint, key);
    }

    private void handleSubscribe(ClientEndpoint endpoint, ClientCommand.Subscribe subscribe)
    {
        SubscriptionRequest request = new SubscriptionRequest(
                endpoint.id(), endpoint.origin(), subscribe.key(), subscribe.attributes(), clock.nowMillis());

        StageResult result = pipeline.process(request);
        if (result instanceof StageResult.Reject reject) {
            sink.onConnectionEvent(new ConnectionEvent(wallClock.now(), ConnectionEvent.Kind.REJECTED,
                    endpoint.id(), endpoint.origin(), Optional.ofNullable(subscribe.key()), request.attributes()));
            send(endpoint, RelayEvent.Error.of(reject.failure(), wallClock.now()));
            return;
        }

        sink.onConnectionEvent(new ConnectionEvent(wallClock.now(), ConnectionEvent.Kind.SUBSCRIBED,
                endpoint.id(), endpoint.origin(), Optional.of(subscribe.key()), request.attributes()));
        send(endpoint, new RelayEvent.Subscribed(subscribe.key(), wallClock.now(), orchestrator.policy().interval()));
        orchestrator.onSubscribed(subscribe.key());
    }

    private void send(ClientEndpoint endpoint, RelayEvent event)
    {
        endpoint.sendText(codec.encode(event));
    }

    private void connectionEvent(ConnectionEvent.Kind kind, ClientEndpoint endpoint, Optional<String> key)
    {
        sink.onConnectionEvent(new ConnectionEvent(wallClock.now(), kind, endpoint.id(), endpoint.origin(), key));
    }
}
