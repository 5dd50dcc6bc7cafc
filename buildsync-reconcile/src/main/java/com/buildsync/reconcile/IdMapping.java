package com.buildsync.reconcile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Source id → target id for classes and fields, which share one id namespace.
 * Only entities present on both sides have an entry; there is no sentinel for missing ones.
 */
public final class IdMapping {

    private final Map<String, String> targetIdsBySourceId;

    public IdMapping(Map<String, String> targetIdsBySourceId) {
        this.targetIdsBySourceId = targetIdsBySourceId != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(targetIdsBySourceId)) : Map.of();
    }

    public Optional<String> targetIdOf(String sourceId) {
        return Optional.ofNullable(sourceId != null ? targetIdsBySourceId.get(sourceId) : null);
    }

    public boolean contains(String sourceId) {
        return sourceId != null && targetIdsBySourceId.containsKey(sourceId);
    }

    public Map<String, String> asMap() {
        return targetIdsBySourceId;
    }

    public int size() {
        return targetIdsBySourceId.size();
    }

    @Override
    public String toString() {
        return "IdMapping" + targetIdsBySourceId;
    }
}
