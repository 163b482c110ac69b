package com.questrail.logrelay.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * RemoteLogResponseParser
 * =============================================================================
 * Turns a remote response body into a {@link RemoteLog}.
 *
 * <h2>Expected shape</h2>
 * <pre>{@code
 * { "<messagesField>": [ "<json text>", "<json text>", ... ] }
 * }</pre>
 *
 * <h2>Leniency</h2>
 * <ul>
 *   <li>A body that is not a JSON object, or lacks the field, or whose field is
 *       not an array, yields {@link RemoteLog#unrecognized()}.</li>
 *   <li>An element that is not a string, is empty, exceeds
 *       {@code maxEntryLength} characters, or does not parse as exactly one JSON
 *       value is dropped. Its position still counts toward the log length.</li>
 * </ul>
 */
public final class RemoteLogResponseParser
{
    private static final Logger log = LoggerFactory.getLogger(RemoteLogResponseParser.class);

    public static final String DEFAULT_MESSAGES_FIELD = "messages";
    public static final int DEFAULT_MAX_ENTRY_LENGTH = 10_000;

    private final ObjectMapper mapper;
    private final String messagesField;
    private final int maxEntryLength;

    public RemoteLogResponseParser(ObjectMapper mapper, String messagesField, int maxEntryLength)
    {
        Objects.requireNonNull(mapper, "mapper");
        this.messagesField = Objects.requireNonNull(messagesField, "messagesField");
        if (maxEntryLength < 1) {
            throw new IllegalArgumentException("maxEntryLength must be >= 1");
        }
        this.maxEntryLength = maxEntryLength;
        this.mapper = mapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public RemoteLogResponseParser(String messagesField)
    {
        this(new ObjectMapper(), messagesField, DEFAULT_MAX_ENTRY_LENGTH);
    }

    public RemoteLog parse(String key, String body)
    {
        JsonNode root;
        try {
            root = body == null || body.isBlank() ? null : mapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("Response for key {} is not valid JSON; treating as empty", key);
            return RemoteLog.unrecognized();
        }

        if (root == null || !root.isObject()) {
            log.warn("Response for key {} is not a JSON object; treating as empty", key);
            return RemoteLog.unrecognized();
        }

        JsonNode messages = root.get(messagesField);
        if (messages == null || !messages.isArray()) {
            log.warn("Response for key {} has no '{}' array; treating as empty", key, messagesField);
            return RemoteLog.unrecognized();
        }

        List<RemoteLogEntry> entries = new ArrayList<>(messages.size());
        int dropped = 0;
        for (int position = 0; position < messages.size(); position++) {
            JsonNode payload = parseEntry(messages.get(position));
            if (payload == null) {
                dropped++;
            }
            else {
                entries.add(new RemoteLogEntry(position, payload));
            }
        }

        if (dropped > 0) {
            log.warn("Dropped {} malformed entries of {} for key {}", dropped, messages.size(), key);
        }
        return RemoteLog.of(entries, messages.size());
    }

    private JsonNode parseEntry(JsonNode element)
    {
        if (element == null || !element.isTextual()) {
            return null;
        }
        String text = element.textValue();
        if (text.isEmpty() || text.length() > maxEntryLength) {
            return null;
        }
        try {
            JsonNode parsed = mapper.readTree(text);
            return parsed == null || parsed.isMissingNode() ? null : parsed;
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
