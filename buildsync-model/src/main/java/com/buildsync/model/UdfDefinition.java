package com.buildsync.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collection;

/**
 * User-defined function as returned by an environment's UDF listing.
 * The body carries the executable code, return type and per-environment metadata; all of it is preserved.
 */
public final class UdfDefinition {

    public static final String NAME = "name";
    public static final String RETURN_TYPE = "return_type";

    private final String id;
    private final ObjectNode body;

    public UdfDefinition(String id, JsonNode body) {
        this.id = id;
        this.body = BuildJson.copyObject(body);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        JsonNode name = body.get(NAME);
        return name != null && !name.isNull() ? name.asText() : null;
    }

    public String getReturnType() {
        JsonNode type = body.get(RETURN_TYPE);
        return type != null && !type.isNull() ? type.asText() : null;
    }

    public boolean has(String attribute) {
        return body.has(attribute);
    }

    /** Copy without the given attributes; absent attributes are ignored. */
    public UdfDefinition without(Collection<String> attributes) {
        ObjectNode copy = body.deepCopy();
        copy.remove(attributes);
        return new UdfDefinition(id, copy);
    }

    public UdfDefinition withReturnType(String returnType) {
        ObjectNode copy = body.deepCopy();
        copy.put(RETURN_TYPE, returnType);
        return new UdfDefinition(id, copy);
    }

    @JsonValue
    public ObjectNode toTree() {
        return body.deepCopy();
    }

    @Override
    public String toString() {
        return "UdfDefinition{id=" + id + ", name=" + getName() + "}";
    }
}
