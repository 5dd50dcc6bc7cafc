package com.buildsync.reconcile;

import com.buildsync.model.ClassDefinition;
import com.buildsync.model.ExtractionLine;
import com.buildsync.model.FieldDefinition;
import com.buildsync.model.SchemaDocument;
import com.buildsync.reconcile.match.EntityIndex;
import com.buildsync.reconcile.match.MatchKeyStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merges a source schema into a target schema.
 * <ul>
 *   <li>Class present on both sides (same match key): updated under the target class id. Source fields
 *       matching a target field keep the target field id; the rest become {@code new_fields} with a minted id.</li>
 *   <li>Class only in the source: added to {@code new_classes} with all its fields as {@code new_fields}.</li>
 * </ul>
 * Every UDF line of every processed field is re-pointed to a UDF freshly created on the target
 * (see {@link UdfReplicator}); running the reconciliation twice creates the UDFs twice.
 */
public final class SchemaReconciler {

    private static final Logger log = LoggerFactory.getLogger(SchemaReconciler.class);

    private final MatchKeyStrategy matchKeys;

    public SchemaReconciler() {
        this(MatchKeyStrategy.BY_NAME);
    }

    public SchemaReconciler(MatchKeyStrategy matchKeys) {
        this.matchKeys = Objects.requireNonNull(matchKeys, "matchKeys");
    }

    /**
     * @param source latest schema (copied from)
     * @param target outdated schema (updated)
     * @param udfs   replicator over the sanitized source UDF catalog, bound to the target project
     * @return payload to post to the target schema endpoint
     * @throws MissingEntityException when a UDF line references a UDF not in the source catalog
     */
    public SchemaPayload reconcile(SchemaDocument source, SchemaDocument target, UdfReplicator udfs) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(udfs, "udfs");

        EntityIndex sourceClasses = EntityIndex.of(source.getClasses(), matchKeys);
        EntityIndex targetClasses = EntityIndex.of(target.getClasses(), matchKeys);
        IdentifierMinter minter = new IdentifierMinter(target.allIds());

        Map<String, ClassPayload> classes = new LinkedHashMap<>();
        List<ClassPayload> newClasses = new ArrayList<>();

        for (Map.Entry<String, String> entry : sourceClasses.asMap().entrySet()) {
            ClassDefinition sourceClass = source.getClasses().get(entry.getValue());
            EntityIndex sourceFields = EntityIndex.of(sourceClass.getFields(), matchKeys);

            String targetClassId = targetClasses.idOf(entry.getKey()).orElse(null);
            if (targetClassId != null) {
                ClassDefinition targetClass = target.getClasses().get(targetClassId);
                EntityIndex targetFields = EntityIndex.of(targetClass.getFields(), matchKeys);
                Map<String, FieldDefinition> fields = new LinkedHashMap<>();
                List<FieldDefinition> newFields = new ArrayList<>();
                for (Map.Entry<String, String> fieldEntry : sourceFields.asMap().entrySet()) {
                    FieldDefinition field = relinkUdfLines(sourceClass.getFields().get(fieldEntry.getValue()), udfs);
                    String targetFieldId = targetFields.idOf(fieldEntry.getKey()).orElse(null);
                    if (targetFieldId != null) {
                        fields.put(targetFieldId, field);
                    } else {
                        newFields.add(field.withUuid(minter.mint()));
                    }
                }
                classes.put(targetClassId, new ClassPayload(
                        sourceClass.getName(), sourceClass.getDescription(), fields, newFields));
                log.debug("Class '{}' matched target id={}: {} existing field(s), {} new field(s)",
                        sourceClass.getName(), targetClassId, fields.size(), newFields.size());
            } else {
                List<FieldDefinition> newFields = new ArrayList<>();
                for (String sourceFieldId : sourceFields.asMap().values()) {
                    FieldDefinition field = relinkUdfLines(sourceClass.getFields().get(sourceFieldId), udfs);
                    newFields.add(field.withUuid(minter.mint()));
                }
                newClasses.add(new ClassPayload(
                        sourceClass.getName(), sourceClass.getDescription(), Map.of(), newFields));
                log.debug("Class '{}' is new on target: {} field(s)", sourceClass.getName(), newFields.size());
            }
        }

        log.info("Schema reconciled: {} class(es) updated, {} class(es) added, {} UDF(s) created",
                classes.size(), newClasses.size(), udfs.getCreatedCount());
        return new SchemaPayload(classes, newClasses);
    }

    /** Copy of the field whose UDF lines invoke UDFs created on the target. */
    private static FieldDefinition relinkUdfLines(FieldDefinition field, UdfReplicator udfs) {
        List<ExtractionLine> lines = field.getLines();
        if (lines.stream().noneMatch(ExtractionLine::isUdf)) {
            return field;
        }
        List<ExtractionLine> relinked = new ArrayList<>(lines.size());
        for (ExtractionLine line : lines) {
            if (line.isUdf()) {
                String newId = udfs.replicate(line.getFunctionId(), "extraction line of field '" + field.getName() + "'");
                relinked.add(line.withFunctionId(newId));
            } else {
                relinked.add(line);
            }
        }
        return field.withLines(relinked);
    }
}
