package com.questrail.logrelay.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.questrail.logrelay.api.RelayFailure.ValidationError;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * InputValidator
 * =============================================================================
 * Guards the subscription boundary.
 *
 * <h2>Keys</h2>
 * A key is accepted only if it is 1 to 100 characters drawn from
 * {@code [A-Za-z0-9_-]}. Keys are checked on their raw value; they are never
 * sanitized into validity.
 *
 * <h2>Other fields</h2>
 * Every other string value is sanitized: angle brackets removed, whitespace
 * trimmed, length capped at {@value #MAX_FIELD_LENGTH} characters.
 * Sanitization never fails.
 *
 * <p>Stateless and thread-safe.</p>
 */
public final class InputValidator
{
    public static final int MAX_KEY_LENGTH = 100;
    public static final int MAX_FIELD_LENGTH = 10_000;

    static final String KEY_REQUIRED = "Key is required to subscribe";
    static final String KEY_LENGTH = "Key must be between 1 and " + MAX_KEY_LENGTH + " characters";
    static final String KEY_CHARACTERS = "Key contains invalid characters";

    private static final Pattern KEY_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");
    private static final Pattern ANGLE_BRACKETS = Pattern.compile("[<>]");

    /**
     * Validate a subscription key.
     *
     * @param key raw key, may be {@code null}
     * @return the validation error, or empty if the key is acceptable
     */
    public Optional<ValidationError> validateKey(String key)
    {
        if (key == null) {
            return Optional.of(new ValidationError(KEY_REQUIRED));
        }
        if (key.isEmpty() || key.length() > MAX_KEY_LENGTH) {
            return Optional.of(new ValidationError(KEY_LENGTH));
        }
        if (!KEY_PATTERN.matcher(key).matches()) {
            return Optional.of(new ValidationError(KEY_CHARACTERS));
        }
        return Optional.empty();
    }

    public boolean isValidKey(String key)
    {
        return validateKey(key).isEmpty();
    }

    /**
     * Sanitize a single string value.
     */
    public String sanitize(String value)
    {
        if (value == null) {
            return null;
        }
        String cleaned = ANGLE_BRACKETS.matcher(value).replaceAll("").trim();
        return cleaned.length() > MAX_FIELD_LENGTH ? cleaned.substring(0, MAX_FIELD_LENGTH) : cleaned;
    }

    /**
     * Return a sanitized copy of a request payload.
     *
     * <p>String values and object field names are sanitized at every depth.
     * Numbers, booleans and nulls pass through unchanged.</p>
     */
    public JsonNode sanitize(JsonNode node)
    {
        if (node == null) {
            return null;
        }
        if (node.isTextual()) {
            return TextNode.valueOf(sanitize(node.textValue()));
        }
        if (node.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode(node.size());
            for (JsonNode element : node) {
                copy.add(sanitize(element));
            }
            return copy;
        }
        if (node.isObject()) {
            ObjectNode copy = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                copy.set(sanitize(field.getKey()), sanitize(field.getValue()));
            }
            return copy;
        }
        return node.deepCopy();
    }
}
