package com.buildsync.reconcile;

import com.buildsync.model.ClassDefinition;
import com.buildsync.model.SchemaDocument;
import com.buildsync.reconcile.match.EntityIndex;
import com.buildsync.reconcile.match.MatchKeyStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the source → target id mapping for classes and fields by match key.
 * The new schema must be the one the target echoed after persisting the reconciled schema: ids of
 * newly created classes and fields exist only from that point on.
 */
public final class FieldIdMapper {

    private static final Logger log = LoggerFactory.getLogger(FieldIdMapper.class);

    private final MatchKeyStrategy matchKeys;

    public FieldIdMapper() {
        this(MatchKeyStrategy.BY_NAME);
    }

    public FieldIdMapper(MatchKeyStrategy matchKeys) {
        this.matchKeys = Objects.requireNonNull(matchKeys, "matchKeys");
    }

    /**
     * @param oldSchema source schema (ids used by the source validation rules)
     * @param newSchema persisted target schema
     * @return mapping covering every class and field present on both sides; others are absent
     */
    public IdMapping map(SchemaDocument oldSchema, SchemaDocument newSchema) {
        Objects.requireNonNull(oldSchema, "oldSchema");
        Objects.requireNonNull(newSchema, "newSchema");
        Map<String, String> mapping = new LinkedHashMap<>();
        EntityIndex oldClasses = EntityIndex.of(oldSchema.getClasses(), matchKeys);
        EntityIndex newClasses = EntityIndex.of(newSchema.getClasses(), matchKeys);

        for (Map.Entry<String, String> entry : oldClasses.asMap().entrySet()) {
            String newClassId = newClasses.idOf(entry.getKey()).orElse(null);
            if (newClassId == null) {
                log.debug("Class '{}' (id={}) not in persisted schema; no mapping", entry.getKey(), entry.getValue());
                continue;
            }
            mapping.put(entry.getValue(), newClassId);
            ClassDefinition oldClass = oldSchema.getClasses().get(entry.getValue());
            ClassDefinition newClass = newSchema.getClasses().get(newClassId);
            EntityIndex newFields = EntityIndex.of(newClass.getFields(), matchKeys);
            EntityIndex.of(oldClass.getFields(), matchKeys).asMap().forEach((key, oldFieldId) ->
                    newFields.idOf(key).ifPresent(newFieldId -> mapping.put(oldFieldId, newFieldId)));
        }
        log.info("Mapped {} class/field id(s) from source to target", mapping.size());
        return new IdMapping(mapping);
    }
}
