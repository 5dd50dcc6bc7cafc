package com.buildsync.reconcile.match;

import com.buildsync.model.NamedEntity;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Matches entities by a stable external key stored in an attribute of the entity body
 * (e.g. {@code external_key}). Entities without that attribute fall back to their name.
 */
public final class AttributeMatchKeyStrategy implements MatchKeyStrategy {

    private final String attribute;

    public AttributeMatchKeyStrategy(String attribute) {
        this.attribute = Objects.requireNonNull(attribute, "attribute");
    }

    @Override
    public String keyOf(NamedEntity entity) {
        if (entity == null) {
            return null;
        }
        JsonNode value = entity.getAttribute(attribute);
        if (value.isValueNode() && !value.isNull() && !value.asText().isBlank()) {
            return attribute + ":" + value.asText();
        }
        return entity.getName();
    }

    @Override
    public String toString() {
        return "attribute(" + attribute + ")";
    }
}
