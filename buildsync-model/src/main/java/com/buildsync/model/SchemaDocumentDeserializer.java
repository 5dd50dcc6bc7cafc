package com.buildsync.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deserializes a schema object whose keys are class ids mixed with metadata keys (e.g. {@code last_edited_at}).
 * Metadata keys and non-object values go to {@link SchemaDocument#getMetadata()}; every other entry is a class.
 */
public final class SchemaDocumentDeserializer extends JsonDeserializer<SchemaDocument> {

    @Override
    public SchemaDocument deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.getCodec().readTree(p);
        if (node != null && !node.isObject() && !node.isNull()) {
            return ctxt.reportInputMismatch(SchemaDocument.class,
                    "Expected schema JSON object, got %s", node.getNodeType());
        }
        return fromTree(node);
    }

    static SchemaDocument fromTree(JsonNode node) {
        if (node == null || !node.isObject()) {
            return SchemaDocument.empty();
        }
        Map<String, ClassDefinition> classes = new LinkedHashMap<>();
        Map<String, JsonNode> metadata = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> {
            if (SchemaDocument.isMetadataKey(e.getKey()) || !e.getValue().isObject()) {
                metadata.put(e.getKey(), e.getValue().deepCopy());
            } else {
                classes.put(e.getKey(), new ClassDefinition(e.getKey(), e.getValue()));
            }
        });
        return new SchemaDocument(classes, metadata);
    }
}
