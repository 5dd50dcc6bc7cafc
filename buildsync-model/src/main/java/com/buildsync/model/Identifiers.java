package com.buildsync.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Environment-local identifiers arrive as JSON numbers or strings depending on the endpoint.
 * Internally every identifier is a string key; all-digit keys are written back as JSON numbers.
 */
public final class Identifiers {

    private Identifiers() {
    }

    /** String key for a JSON id value; null, missing or container nodes yield {@code null}. */
    public static String asKey(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    /**
     * String keys for a JSON array of ids. An absent or JSON null value yields an empty list.
     *
     * @throws IllegalArgumentException when the value is present but not an array, or holds a null or
     *                                  container element
     */
    public static List<String> asKeys(JsonNode values) {
        List<String> keys = new ArrayList<>();
        if (values == null || values.isMissingNode() || values.isNull()) {
            return keys;
        }
        if (!values.isArray()) {
            throw new IllegalArgumentException("expected an array of ids, got " + values);
        }
        for (JsonNode value : values) {
            String key = asKey(value);
            if (key == null) {
                throw new IllegalArgumentException("array of ids holds a non-id element " + value + ": " + values);
            }
            keys.add(key);
        }
        return keys;
    }

    public static boolean isNumeric(String key) {
        if (key == null || key.isEmpty() || key.length() > 18) {
            return false;
        }
        for (int i = 0; i < key.length(); i++) {
            if (!Character.isDigit(key.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /** JSON value for an id key: a number node for all-digit keys, otherwise a text node. */
    public static JsonNode toNode(String key) {
        if (key == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (isNumeric(key)) {
            return JsonNodeFactory.instance.numberNode(Long.parseLong(key));
        }
        return JsonNodeFactory.instance.textNode(key);
    }
}
