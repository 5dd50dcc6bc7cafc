package com.buildsync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Validation listing of a build project: {@code {"rules": [...]}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ValidationDocument {

    private final List<ValidationRule> rules;

    @JsonCreator
    public ValidationDocument(@JsonProperty("rules") List<ValidationRule> rules) {
        this.rules = rules != null ? List.copyOf(rules) : List.of();
    }

    public static ValidationDocument empty() {
        return new ValidationDocument(List.of());
    }

    public static ValidationDocument fromJson(String json) {
        return BuildJson.fromJson(json, ValidationDocument.class);
    }

    public List<ValidationRule> getRules() {
        return rules;
    }
}
