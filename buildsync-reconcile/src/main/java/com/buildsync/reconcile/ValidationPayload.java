package com.buildsync.reconcile;

import com.buildsync.model.IdentifierSerializer;
import com.buildsync.model.ValidationKind;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Validation rule ready to post to the target project; every field and class id in it is a target id.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"projectId", "name", "type", "affected_fields", "alert_level", "scope",
        "description", "input_fields", "params"})
public final class ValidationPayload {

    private final String projectId;
    private final String name;
    private final String type;
    private final List<String> affectedFields;
    private final JsonNode alertLevel;
    private final JsonNode scope;
    private final String description;
    private final List<String> inputFields;
    private final ObjectNode params;

    public ValidationPayload(String projectId, String name, String type,
                             List<String> affectedFields, JsonNode alertLevel, JsonNode scope,
                             String description, List<String> inputFields, ObjectNode params) {
        this.projectId = projectId;
        this.name = name;
        this.type = type;
        this.affectedFields = affectedFields != null ? List.copyOf(affectedFields) : List.of();
        this.alertLevel = alertLevel;
        this.scope = scope;
        this.description = description != null ? description : "";
        this.inputFields = inputFields != null ? List.copyOf(inputFields) : List.of();
        this.params = params != null ? params.deepCopy() : null;
    }

    @JsonProperty("projectId")
    public String getProjectId() {
        return projectId;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("type")
    public String getType() {
        return type;
    }

    @JsonIgnore
    public ValidationKind getKind() {
        return ValidationKind.fromType(type);
    }

    @JsonProperty("affected_fields")
    @JsonSerialize(contentUsing = IdentifierSerializer.class)
    public List<String> getAffectedFields() {
        return affectedFields;
    }

    @JsonProperty("alert_level")
    public JsonNode getAlertLevel() {
        return alertLevel;
    }

    @JsonProperty("scope")
    public JsonNode getScope() {
        return scope;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @JsonProperty("input_fields")
    @JsonSerialize(contentUsing = IdentifierSerializer.class)
    public List<String> getInputFields() {
        return inputFields;
    }

    /** Copy of the rewritten parameters. */
    @JsonProperty("params")
    public ObjectNode getParams() {
        return params != null ? params.deepCopy() : null;
    }

    @Override
    public String toString() {
        return "ValidationPayload{name=" + name + ", type=" + type + "}";
    }
}
