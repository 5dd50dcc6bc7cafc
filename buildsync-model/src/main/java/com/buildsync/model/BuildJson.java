package com.buildsync.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Shared {@link ObjectMapper} for build project documents.
 * JSON excludes null values when serializing.
 */
public final class BuildJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private BuildJson() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Deserializes a document from a JSON string.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static <T> T fromJson(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Converts an already parsed tree to the given type. */
    public static <T> T fromTree(JsonNode tree, Class<T> type) {
        try {
            return MAPPER.treeToValue(tree, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    public static JsonNode readTree(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * Serializes any document or payload to a compact JSON string (nulls excluded).
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    public static JsonNode toTree(Object value) {
        return MAPPER.valueToTree(value);
    }

    public static ObjectNode newObject() {
        return MAPPER.createObjectNode();
    }

    /** Deep copy of an object node; {@code null} or non-object input yields an empty object. */
    static ObjectNode copyObject(JsonNode node) {
        if (node == null || !node.isObject()) {
            return MAPPER.createObjectNode();
        }
        return ((ObjectNode) node).deepCopy();
    }
}
