package com.buildsync.reconcile;

import com.buildsync.model.FieldDefinition;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reconciled class: fields that already exist on the target keyed by target field id, and new fields
 * carrying a minted {@code uuid}.
 */
@JsonPropertyOrder({"name", "description", "fields", "new_fields"})
public final class ClassPayload {

    private final String name;
    private final String description;
    private final Map<String, FieldDefinition> fields;
    private final List<FieldDefinition> newFields;

    public ClassPayload(String name, String description,
                        Map<String, FieldDefinition> fields, List<FieldDefinition> newFields) {
        this.name = name;
        this.description = description;
        this.fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
        this.newFields = newFields != null ? List.copyOf(newFields) : List.of();
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    /** Existing target fields, keyed by target field id. */
    @JsonProperty("fields")
    public Map<String, FieldDefinition> getFields() {
        return fields;
    }

    @JsonProperty("new_fields")
    public List<FieldDefinition> getNewFields() {
        return newFields;
    }
}
