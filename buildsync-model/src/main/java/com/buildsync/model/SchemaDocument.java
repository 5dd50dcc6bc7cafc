package com.buildsync.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Extraction schema of a build project: classes keyed by environment-local class id.
 * Edit timestamps ({@value #LAST_EDITED_AT}, {@value #LAST_EDITED_CLASS_AT}) share the container with the
 * classes; they are kept in {@link #getMetadata()} and are never treated as entities.
 */
@JsonDeserialize(using = SchemaDocumentDeserializer.class)
public final class SchemaDocument {

    public static final String LAST_EDITED_AT = "last_edited_at";
    public static final String LAST_EDITED_CLASS_AT = "last_edited_class_at";
    private static final Set<String> METADATA_KEYS = Set.of(LAST_EDITED_AT, LAST_EDITED_CLASS_AT);

    private final Map<String, ClassDefinition> classes;
    private final Map<String, JsonNode> metadata;

    public SchemaDocument(Map<String, ClassDefinition> classes, Map<String, JsonNode> metadata) {
        this.classes = classes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(classes)) : Map.of();
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public static SchemaDocument empty() {
        return new SchemaDocument(Map.of(), Map.of());
    }

    public static SchemaDocument fromJson(String json) {
        return BuildJson.fromJson(json, SchemaDocument.class);
    }

    public static SchemaDocument fromTree(JsonNode tree) {
        return SchemaDocumentDeserializer.fromTree(tree);
    }

    /** True for keys that carry document metadata rather than an entity. */
    public static boolean isMetadataKey(String key) {
        return METADATA_KEYS.contains(key);
    }

    /** Classes in document order, keyed by class id. */
    public Map<String, ClassDefinition> getClasses() {
        return classes;
    }

    public Optional<ClassDefinition> getClass(String classId) {
        return Optional.ofNullable(classes.get(classId));
    }

    public Map<String, JsonNode> getMetadata() {
        return metadata;
    }

    /** Every class and field id present in this schema. */
    public Set<String> allIds() {
        Set<String> ids = new HashSet<>(classes.keySet());
        for (ClassDefinition cls : classes.values()) {
            ids.addAll(cls.getFields().keySet());
        }
        return ids;
    }

    @JsonValue
    public ObjectNode toTree() {
        ObjectNode root = BuildJson.newObject();
        classes.forEach((id, cls) -> root.set(id, cls.toTree()));
        metadata.forEach((key, value) -> root.set(key, value.deepCopy()));
        return root;
    }
}
