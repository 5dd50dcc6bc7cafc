package com.buildsync.reconcile.match;

import com.buildsync.model.NamedEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Match key → entity id index over one container of entities (the classes of a schema or the fields of a class).
 * Metadata keys never reach the index because the model does not expose them as entities.
 * When two entities share a key the later one wins.
 */
public final class EntityIndex {

    private static final Logger log = LoggerFactory.getLogger(EntityIndex.class);

    private final Map<String, String> idsByKey;

    private EntityIndex(Map<String, String> idsByKey) {
        this.idsByKey = Collections.unmodifiableMap(idsByKey);
    }

    public static EntityIndex of(Map<String, ? extends NamedEntity> entities, MatchKeyStrategy strategy) {
        Map<String, String> idsByKey = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends NamedEntity> e : entities.entrySet()) {
            String key = strategy.keyOf(e.getValue());
            if (key == null) {
                log.debug("Entity id={} has no match key under strategy={}; not indexed", e.getKey(), strategy);
                continue;
            }
            String previous = idsByKey.put(key, e.getKey());
            if (previous != null) {
                log.debug("Duplicate match key '{}': id={} replaces id={}", key, e.getKey(), previous);
            }
        }
        return new EntityIndex(idsByKey);
    }

    public Optional<String> idOf(String key) {
        return Optional.ofNullable(key != null ? idsByKey.get(key) : null);
    }

    public boolean contains(String key) {
        return key != null && idsByKey.containsKey(key);
    }

    /** Key → id in container order (later duplicates already applied). */
    public Map<String, String> asMap() {
        return idsByKey;
    }

    public int size() {
        return idsByKey.size();
    }
}
