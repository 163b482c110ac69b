package com.questrail.logrelay.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.logrelay.api.ClientCommand;
import com.questrail.logrelay.api.RelayEvent;
import com.questrail.logrelay.validation.InputValidator;

import java.util.Objects;

/**
 * RelayFrameCodec
 * =============================================================================
 * JSON framing for the client protocol.
 *
 * <h2>Envelope</h2>
 * Every frame, in both directions, is a JSON object
 * <pre>{@code { "event": "<name>", "data": <payload> } }</pre>
 *
 * <h2>Outbound</h2>
 * <table>
 *   <tr><th>event</th><th>data</th></tr>
 *   <tr><td>connected</td><td>{@code {id, timestamp, config:{pollingInterval, maxMessagesPerBatch}}}</td></tr>
 *   <tr><td>subscribed</td><td>{@code {key, timestamp, interval}}</td></tr>
 *   <tr><td>message</td><td>the relayed entry, verbatim</td></tr>
 *   <tr><td>error</td><td>{@code {message, details?, timestamp}}</td></tr>
 *   <tr><td>pong</td><td>{@code {timestamp}} in epoch milliseconds</td></tr>
 * </table>
 * Timestamps other than {@code pong}'s are ISO-8601 strings; intervals are
 * milliseconds.
 *
 * <h2>Inbound</h2>
 * {@code subscribe} (or its legacy alias {@code startPolling}) with
 * {@code data.key}, and {@code ping}. The key is taken raw; every other field of
 * {@code data} is sanitized by the {@link InputValidator}.
 *
 * <p>Thread-safe.</p>
 */
public final class RelayFrameCodec
{
    public static final String SUBSCRIBE = "subscribe";
    public static final String START_POLLING = "startPolling";
    public static final String PING = "ping";

    private final ObjectMapper mapper;
    private final InputValidator validator;

    public RelayFrameCodec(ObjectMapper mapper, InputValidator validator)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public String encode(RelayEvent event)
    {
        Objects.requireNonNull(event, "event");
        ObjectNode frame = JsonNodeFactory.instance.objectNode();
        frame.put("event", event.name());
        frame.set("data", payloadOf(event));
        try {
            return mapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + event.name() + " event", e);
        }
    }

    /**
     * Decode one inbound text frame.
     *
     * @throws RelayDecodeException if the frame is not a well-formed envelope
     */
    public ClientCommand decode(String frame)
    {
        Objects.requireNonNull(frame, "frame");

        JsonNode root;
        try {
            root = mapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new RelayDecodeException("Frame is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new RelayDecodeException("Frame is not a JSON object");
        }

        JsonNode event = root.get("event");
        if (event == null || !event.isTextual()) {
            throw new RelayDecodeException("Frame has no event name");
        }

        JsonNode data = root.get("data");
        switch (event.textValue()) {
            case SUBSCRIBE:
            case START_POLLING:
                return decodeSubscribe(data);
            case PING:
                return new ClientCommand.Ping();
            default:
                return new ClientCommand.Unsupported(event.textValue());
        }
    }

    private ClientCommand.Subscribe decodeSubscribe(JsonNode data)
    {
        if (data == null || !data.isObject()) {
            return new ClientCommand.Subscribe(null, null);
        }
        JsonNode key = data.get("key");
        ObjectNode attributes = ((ObjectNode) data).deepCopy();
        attributes.remove("key");
        return new ClientCommand.Subscribe(
                key != null && key.isTextual() ? key.textValue() : null,
                validator.sanitize(attributes));
    }

    private JsonNode payloadOf(RelayEvent event)
    {
        JsonNodeFactory f = JsonNodeFactory.instance;
        if (event instanceof RelayEvent.Connected c) {
            ObjectNode data = f.objectNode();
            data.put("id", c.connectionId());
            data.put("timestamp", c.timestamp().toString());
            ObjectNode config = data.putObject("config");
            config.put("pollingInterval", c.pollingInterval().toMillis());
            config.put("maxMessagesPerBatch", c.maxMessagesPerBatch());
            return data;
        }
        if (event instanceof RelayEvent.Subscribed s) {
            ObjectNode data = f.objectNode();
            data.put("key", s.key());
            data.put("timestamp", s.timestamp().toString());
            data.put("interval", s.interval().toMillis());
            return data;
        }
        if (event instanceof RelayEvent.Message m) {
            return m.payload();
        }
        if (event instanceof RelayEvent.Error e) {
            ObjectNode data = f.objectNode();
            data.put("message", e.message());
            e.details().ifPresent(d -> data.put("details", d));
            data.put("timestamp", e.timestamp().toString());
            return data;
        }
        if (event instanceof RelayEvent.Pong p) {
            ObjectNode data = f.objectNode();
            data.put("timestamp", p.timestampMillis());
            return data;
        }
        throw new IllegalArgumentException("Unknown event type: " + event.getClass().getName());
    }
}
