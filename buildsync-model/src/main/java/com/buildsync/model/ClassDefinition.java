package com.buildsync.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Class of an extraction schema: name, description and its fields keyed by environment-local field id.
 * The {@code fields} container may hold metadata keys (see {@link SchemaDocument#isMetadataKey(String)});
 * those are not fields and are never returned by {@link #getFields()}.
 */
public final class ClassDefinition implements NamedEntity {

    static final String NAME = "name";
    static final String DESCRIPTION = "description";
    static final String FIELDS = "fields";

    private final String id;
    private final ObjectNode body;
    private final Map<String, FieldDefinition> fields;

    public ClassDefinition(String id, JsonNode body) {
        this.id = id;
        this.body = BuildJson.copyObject(body);
        this.fields = Collections.unmodifiableMap(parseFields(this.body.get(FIELDS)));
    }

    private static Map<String, FieldDefinition> parseFields(JsonNode container) {
        Map<String, FieldDefinition> result = new LinkedHashMap<>();
        if (container == null || !container.isObject()) {
            return result;
        }
        container.fields().forEachRemaining(e -> {
            if (!SchemaDocument.isMetadataKey(e.getKey()) && e.getValue().isObject()) {
                result.put(e.getKey(), new FieldDefinition(e.getKey(), e.getValue()));
            }
        });
        return result;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getName() {
        JsonNode name = body.get(NAME);
        return name != null && !name.isNull() ? name.asText() : null;
    }

    /** Description text; empty when absent. */
    public String getDescription() {
        JsonNode description = body.get(DESCRIPTION);
        return description != null && !description.isNull() ? description.asText() : "";
    }

    @Override
    public JsonNode getAttribute(String attribute) {
        JsonNode value = body.get(attribute);
        return value != null ? value : MissingNode.getInstance();
    }

    /** Fields in document order, keyed by field id. */
    public Map<String, FieldDefinition> getFields() {
        return fields;
    }

    @JsonValue
    public ObjectNode toTree() {
        return body.deepCopy();
    }

    @Override
    public String toString() {
        return "ClassDefinition{id=" + id + ", name=" + getName() + ", fields=" + fields.size() + "}";
    }
}
