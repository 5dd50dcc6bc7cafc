package com.buildsync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * All user-defined functions of a build project, keyed by UDF id in listing order.
 */
public final class UdfCatalog {

    private final Map<String, UdfDefinition> udfs;

    public UdfCatalog(Map<String, UdfDefinition> udfs) {
        this.udfs = udfs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(udfs)) : Map.of();
    }

    /** Used when the payload is the JSON object {@code {"<udfId>": {...}, ...}}. */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static UdfCatalog fromTree(JsonNode tree) {
        Map<String, UdfDefinition> udfs = new LinkedHashMap<>();
        if (tree != null && tree.isObject()) {
            tree.fields().forEachRemaining(e -> {
                if (e.getValue().isObject()) {
                    udfs.put(e.getKey(), new UdfDefinition(e.getKey(), e.getValue()));
                }
            });
        }
        return new UdfCatalog(udfs);
    }

    public static UdfCatalog fromJson(String json) {
        return fromTree(BuildJson.readTree(json));
    }

    public static UdfCatalog empty() {
        return new UdfCatalog(Map.of());
    }

    public Optional<UdfDefinition> get(String udfId) {
        return Optional.ofNullable(udfId != null ? udfs.get(udfId) : null);
    }

    public Map<String, UdfDefinition> asMap() {
        return udfs;
    }

    public int size() {
        return udfs.size();
    }

    @JsonValue
    public ObjectNode toTree() {
        ObjectNode root = BuildJson.newObject();
        udfs.forEach((id, udf) -> root.set(id, udf.toTree()));
        return root;
    }
}
