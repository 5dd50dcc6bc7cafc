package com.buildsync.reconcile;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schema update for the target: {@code classes} updates existing target classes (keyed by target class id),
 * {@code new_classes} lists classes the target does not have yet; the target assigns their ids when persisting.
 */
@JsonPropertyOrder({"classes", "new_classes"})
public final class SchemaPayload {

    private final Map<String, ClassPayload> classes;
    private final List<ClassPayload> newClasses;

    public SchemaPayload(Map<String, ClassPayload> classes, List<ClassPayload> newClasses) {
        this.classes = classes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(classes)) : Map.of();
        this.newClasses = newClasses != null ? List.copyOf(newClasses) : List.of();
    }

    @JsonProperty("classes")
    public Map<String, ClassPayload> getClasses() {
        return classes;
    }

    @JsonProperty("new_classes")
    public List<ClassPayload> getNewClasses() {
        return newClasses;
    }
}
