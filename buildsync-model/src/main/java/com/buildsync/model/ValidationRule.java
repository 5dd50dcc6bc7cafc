package com.buildsync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Validation rule of a build project. {@code affected_fields} and {@code input_fields} hold field ids;
 * {@code params} is free-form and may embed class ids ({@code affected_classes}) or a UDF id ({@code udf_id}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ValidationRule {

    public static final String PARAM_AFFECTED_CLASSES = "affected_classes";
    public static final String PARAM_UDF_ID = "udf_id";

    private final String id;
    private final String name;
    private final String type;
    private final JsonNode alertLevel;
    private final JsonNode scope;
    private final String description;
    private final JsonNode affectedFields;
    private final JsonNode inputFields;
    private final ObjectNode params;

    @JsonCreator
    public ValidationRule(
            @JsonProperty("id") JsonNode id,
            @JsonProperty("name") String name,
            @JsonProperty("type") String type,
            @JsonProperty("alert_level") JsonNode alertLevel,
            @JsonProperty("scope") JsonNode scope,
            @JsonProperty("description") String description,
            @JsonProperty("affected_fields") JsonNode affectedFields,
            @JsonProperty("input_fields") JsonNode inputFields,
            @JsonProperty("params") JsonNode params) {
        this.id = Identifiers.asKey(id);
        this.name = name;
        this.type = type;
        this.alertLevel = alertLevel;
        this.scope = scope;
        this.description = description;
        this.affectedFields = affectedFields != null ? affectedFields.deepCopy() : null;
        this.inputFields = inputFields != null ? inputFields.deepCopy() : null;
        this.params = BuildJson.copyObject(params);
    }

    /** Environment-local rule id; {@code null} for rules not yet persisted. */
    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /** Raw rule type as sent by the environment (e.g. {@code CLASS_CONFIDENCE}). */
    public String getType() {
        return type;
    }

    public ValidationKind getKind() {
        return ValidationKind.fromType(type);
    }

    public JsonNode getAlertLevel() {
        return alertLevel;
    }

    public JsonNode getScope() {
        return scope;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @throws IllegalArgumentException when {@code affected_fields} is present but not a list of ids
     */
    public List<String> getAffectedFields() {
        return List.copyOf(Identifiers.asKeys(affectedFields));
    }

    /**
     * @throws IllegalArgumentException when {@code input_fields} is present but not a list of ids
     */
    public List<String> getInputFields() {
        return List.copyOf(Identifiers.asKeys(inputFields));
    }

    /** {@code affected_fields} as received; {@code null} when absent. */
    public JsonNode getAffectedFieldsNode() {
        return affectedFields != null ? affectedFields.deepCopy() : null;
    }

    /** {@code input_fields} as received; {@code null} when absent. */
    public JsonNode getInputFieldsNode() {
        return inputFields != null ? inputFields.deepCopy() : null;
    }

    /** Copy of the rule parameters; never null. */
    public ObjectNode getParams() {
        return params.deepCopy();
    }

    @Override
    public String toString() {
        return "ValidationRule{id=" + id + ", name=" + name + ", type=" + type + "}";
    }
}
