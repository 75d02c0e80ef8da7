package com.eventmirror.core.match;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Flexible structural matching over Jackson trees.
 *
 * <h3>Subset rules ({@link #matches(JsonNode, JsonNode)})</h3>
 * <ul>
 * <li>{@code "*"} matches any scalar or null; objects and arrays do not
 * match it</li>
 * <li>{@code ""} matches only the empty string</li>
 * <li>{@code "~text"} matches a string containing {@code text}</li>
 * <li>any other string matches when the actual value's text form is equal
 * (so {@code "42"} matches the number {@code 42})</li>
 * <li>numbers compare by value, regardless of their JSON representation</li>
 * <li>objects: every expected key must be present and match</li>
 * <li>arrays: every expected element must match some actual element, in any
 * order</li>
 * <li>an actual string holding serialized JSON is parsed and matched
 * recursively</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class JsonMatchers {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String ANY = "*";
    public static final String CONTAINS_PREFIX = "~";

    private JsonMatchers() {
        // utility class, not instantiable
    }

    /**
     * Recursively match {@code actual} against the {@code expected} pattern.
     *
     * @param actual   the observed tree; {@code null} is treated as JSON null
     * @param expected the pattern; must not be {@code null}
     * @return {@code true} if {@code actual} satisfies the pattern
     */
    public static boolean matches(JsonNode actual, JsonNode expected) {
        Objects.requireNonNull(expected, "Expected pattern must not be null");
        JsonNode value = actual != null && !actual.isMissingNode() ? actual : MAPPER.nullNode();

        if (expected.isValueNode() || expected.isNull()) {
            if (value.isValueNode() || value.isNull()) {
                return matchPrimitive(value, expected);
            }
            return false;
        }

        if (expected.isObject()) {
            if (value.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = expected.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    if (!value.has(field.getKey()) || !matches(value.get(field.getKey()), field.getValue())) {
                        return false;
                    }
                }
                return true;
            }
            return parseEmbedded(value).map(parsed -> matches(parsed, expected)).orElse(false);
        }

        if (expected.isArray()) {
            if (value.isArray()) {
                for (JsonNode wanted : expected) {
                    if (!anyElementMatches(value, wanted)) {
                        return false;
                    }
                }
                return true;
            }
            return parseEmbedded(value).map(parsed -> matches(parsed, expected)).orElse(false);
        }

        return false;
    }

    /**
     * Depth-first search for {@code key} anywhere in the tree whose value
     * matches {@code expected}.
     *
     * @param element  tree to search
     * @param key      field name to look for
     * @param expected pattern the field value must satisfy
     * @return {@code true} if any occurrence matches
     */
    public static boolean containsKeyValue(JsonNode element, String key, JsonNode expected) {
        if (element == null) {
            return false;
        }
        if (element.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = element.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getKey().equals(key) && matches(field.getValue(), expected)) {
                    return true;
                }
                if (containsKeyValue(field.getValue(), key, expected)) {
                    return true;
                }
            }
            return false;
        }
        if (element.isArray()) {
            for (JsonNode item : element) {
                if (containsKeyValue(item, key, expected)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Check that every key/value pair of {@code keyValues} occurs somewhere in
     * {@code payload}. Pairs may sit in different branches.
     *
     * <p>
     * A dedicated data node ({@code event.data} or {@code data}) is searched
     * first, then the whole payload.
     * </p>
     *
     * @param payload   event body
     * @param keyValues object whose fields are the required pairs
     * @return {@code true} if all pairs are found; {@code false} if
     *         {@code keyValues} is not an object
     */
    public static boolean containsAll(JsonNode payload, JsonNode keyValues) {
        if (payload == null || keyValues == null || !keyValues.isObject()) {
            return false;
        }
        JsonNode dataNode = dataNode(payload);
        Iterator<Map.Entry<String, JsonNode>> pairs = keyValues.fields();
        while (pairs.hasNext()) {
            Map.Entry<String, JsonNode> pair = pairs.next();
            boolean found = dataNode != null && containsKeyValue(dataNode, pair.getKey(), pair.getValue());
            if (!found && !containsKeyValue(payload, pair.getKey(), pair.getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Resolve a dot-separated field path ({@code meta.event.name}).
     *
     * @param root tree to walk
     * @param path dot-separated path; blank resolves to nothing
     * @return the node at the path, or empty if any segment is absent
     */
    public static Optional<JsonNode> at(JsonNode root, String path) {
        if (root == null || path == null || path.isBlank()) {
            return Optional.empty();
        }
        JsonNode current = root;
        for (String segment : path.split("\\.")) {
            if (current == null || !current.isObject() || !current.has(segment)) {
                return Optional.empty();
            }
            current = current.get(segment);
        }
        return Optional.ofNullable(current);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static boolean matchPrimitive(JsonNode actual, JsonNode expected) {
        if (expected.isTextual()) {
            String pattern = expected.textValue();
            if (ANY.equals(pattern)) {
                return true;
            }
            if (pattern.isEmpty()) {
                return actual.isTextual() && actual.textValue().isEmpty();
            }
            if (pattern.startsWith(CONTAINS_PREFIX)) {
                return actual.isTextual() && actual.textValue().contains(pattern.substring(1));
            }
            return actual.asText().equals(pattern);
        }
        if (expected.isNumber() && actual.isNumber()) {
            return expected.decimalValue().compareTo(actual.decimalValue()) == 0;
        }
        return expected.equals(actual);
    }

    private static boolean anyElementMatches(JsonNode array, JsonNode wanted) {
        for (JsonNode candidate : array) {
            if (matches(candidate, wanted)) {
                return true;
            }
        }
        return false;
    }

    private static Optional<JsonNode> parseEmbedded(JsonNode value) {
        if (!value.isTextual()) {
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.readTree(value.textValue()));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private static JsonNode dataNode(JsonNode payload) {
        JsonNode event = payload.get("event");
        if (event != null && event.isObject() && event.has("data")) {
            return event.get("data");
        }
        return payload.isObject() ? payload.get("data") : null;
    }
}
