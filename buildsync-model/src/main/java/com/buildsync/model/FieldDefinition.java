package com.buildsync.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Field of a schema class. The body is kept as-is; only {@code name}, {@code lines} and {@code uuid}
 * are interpreted. Instances are immutable; {@code with*} methods return modified copies.
 */
public final class FieldDefinition implements NamedEntity {

    static final String NAME = "name";
    static final String LINES = "lines";
    static final String UUID = "uuid";

    private final String id;
    private final ObjectNode body;

    public FieldDefinition(String id, JsonNode body) {
        this.id = id;
        this.body = BuildJson.copyObject(body);
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

    @Override
    public JsonNode getAttribute(String attribute) {
        JsonNode value = body.get(attribute);
        return value != null ? value : MissingNode.getInstance();
    }

    public List<ExtractionLine> getLines() {
        JsonNode lines = body.get(LINES);
        if (lines == null || !lines.isArray()) {
            return List.of();
        }
        List<ExtractionLine> result = new ArrayList<>(lines.size());
        for (JsonNode line : lines) {
            result.add(new ExtractionLine(line));
        }
        return Collections.unmodifiableList(result);
    }

    /** Client-minted id of a field not yet persisted; {@code null} for persisted fields. */
    public String getUuid() {
        JsonNode uuid = body.get(UUID);
        return uuid != null && !uuid.isNull() ? uuid.asText() : null;
    }

    public FieldDefinition withLines(List<ExtractionLine> lines) {
        Objects.requireNonNull(lines, "lines");
        ObjectNode copy = body.deepCopy();
        ArrayNode array = copy.putArray(LINES);
        for (ExtractionLine line : lines) {
            array.add(line.toTree());
        }
        return new FieldDefinition(id, copy);
    }

    public FieldDefinition withUuid(String uuid) {
        ObjectNode copy = body.deepCopy();
        copy.put(UUID, uuid);
        return new FieldDefinition(id, copy);
    }

    @JsonValue
    public ObjectNode toTree() {
        return body.deepCopy();
    }

    @Override
    public String toString() {
        return "FieldDefinition{id=" + id + ", name=" + getName() + "}";
    }
}
