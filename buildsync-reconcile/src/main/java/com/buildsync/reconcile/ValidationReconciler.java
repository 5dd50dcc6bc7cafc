package com.buildsync.reconcile;

import com.buildsync.model.Identifiers;
import com.buildsync.model.UdfCatalog;
import com.buildsync.model.ValidationDocument;
import com.buildsync.model.ValidationKind;
import com.buildsync.model.ValidationRule;
import com.buildsync.reconcile.api.BuildProjectWriter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns source validation rules into payloads for the target project.
 * <p>
 * Per source rule, in order: a target rule with the same name is deleted on the target; field references
 * ({@code affected_fields}, {@code input_fields}, and {@code params.affected_classes} for class-confidence
 * rules) are rewritten through the {@link IdMapping}; for UDF and prompt-UDF rules the referenced UDF is
 * re-created on the target, {@code params.udf_id} re-pointed, and example generation started for it.
 * Persisting the payloads and the prompt-UDF code generation that follows are left to the caller.
 * <p>
 * A class-confidence rule without {@code params.affected_classes} is passed through with its params unchanged.
 */
public final class ValidationReconciler {

    private static final Logger log = LoggerFactory.getLogger(ValidationReconciler.class);

    private final BuildProjectWriter target;
    private final String targetProjectId;

    public ValidationReconciler(BuildProjectWriter target, String targetProjectId) {
        this.target = Objects.requireNonNull(target, "target");
        this.targetProjectId = Objects.requireNonNull(targetProjectId, "targetProjectId");
    }

    /** Same as {@link #reconcile(ValidationDocument, ValidationDocument, IdMapping, UdfReplicator)} with a replicator over {@code sanitizedUdfs}. */
    public List<ValidationPayload> reconcile(ValidationDocument targetValidations,
                                             ValidationDocument sourceValidations,
                                             IdMapping mapping,
                                             UdfCatalog sanitizedUdfs) {
        return reconcile(targetValidations, sourceValidations, mapping,
                new UdfReplicator(target, targetProjectId, sanitizedUdfs));
    }

    /**
     * @param targetValidations rules currently on the target
     * @param sourceValidations rules to copy
     * @param mapping           source → target class/field ids (from {@link FieldIdMapper})
     * @param udfs              replicator over the sanitized source UDF catalog, bound to the target project
     * @return payloads in source order
     * @throws UnmappedReferenceException when a rule references an id absent from the mapping
     * @throws MissingEntityException     when a UDF-backed rule references a UDF absent from the catalog
     */
    public List<ValidationPayload> reconcile(ValidationDocument targetValidations,
                                             ValidationDocument sourceValidations,
                                             IdMapping mapping,
                                             UdfReplicator udfs) {
        Objects.requireNonNull(sourceValidations, "sourceValidations");
        Objects.requireNonNull(mapping, "mapping");
        Objects.requireNonNull(udfs, "udfs");

        Map<String, String> targetIdsByName = new HashMap<>();
        if (targetValidations != null) {
            for (ValidationRule rule : targetValidations.getRules()) {
                targetIdsByName.put(rule.getName(), rule.getId());
            }
        }

        List<ValidationPayload> payloads = new ArrayList<>();
        int replaced = 0;
        for (ValidationRule rule : sourceValidations.getRules()) {
            if (targetIdsByName.containsKey(rule.getName())) {
                String existingId = targetIdsByName.get(rule.getName());
                target.deleteValidation(targetProjectId, existingId);
                replaced++;
                log.debug("Deleted target rule '{}' id={} before re-creating it", rule.getName(), existingId);
            }
            payloads.add(toPayload(rule, mapping, udfs));
        }
        log.info("Validations reconciled: {} rule(s), {} replacing existing target rule(s)", payloads.size(), replaced);
        return payloads;
    }

    private ValidationPayload toPayload(ValidationRule rule, IdMapping mapping, UdfReplicator udfs) {
        List<String> affectedFields = rewrite(rule.getAffectedFieldsNode(), mapping, rule.getName(), "affected_fields");
        List<String> inputFields = rewrite(rule.getInputFieldsNode(), mapping, rule.getName(), "input_fields");
        ObjectNode params = rule.getParams();
        ValidationKind kind = rule.getKind();

        if (kind == ValidationKind.CLASS_CONFIDENCE && params.has(ValidationRule.PARAM_AFFECTED_CLASSES)) {
            List<String> rewritten = rewrite(params.get(ValidationRule.PARAM_AFFECTED_CLASSES), mapping,
                    rule.getName(), "params." + ValidationRule.PARAM_AFFECTED_CLASSES);
            ArrayNode array = params.putArray(ValidationRule.PARAM_AFFECTED_CLASSES);
            rewritten.forEach(id -> array.add(Identifiers.toNode(id)));
        }

        if (kind.isUdfBacked()) {
            JsonNode udfRef = params.get(ValidationRule.PARAM_UDF_ID);
            String sourceUdfId = Identifiers.asKey(udfRef);
            if (sourceUdfId == null) {
                throw new MissingEntityException(EntityKind.UDF, String.valueOf(udfRef),
                        "params." + ValidationRule.PARAM_UDF_ID + " of rule '" + rule.getName() + "'");
            }
            String newUdfId = udfs.replicate(sourceUdfId, "validation rule '" + rule.getName() + "'");
            target.triggerExamples(targetProjectId, newUdfId);
            params.set(ValidationRule.PARAM_UDF_ID, Identifiers.toNode(newUdfId));
        }

        return new ValidationPayload(targetProjectId, rule.getName(), rule.getType(), affectedFields,
                rule.getAlertLevel(), rule.getScope(), rule.getDescription(), inputFields, params);
    }

    /**
     * Rewrites every id of a JSON id list through the mapping. An absent or null list is empty; anything
     * else that is not a list of ids, or any unmapped id, fails the whole reconciliation.
     */
    static List<String> rewrite(JsonNode sourceIds, IdMapping mapping, String ruleName, String location) {
        List<String> result = new ArrayList<>();
        if (sourceIds == null || sourceIds.isMissingNode() || sourceIds.isNull()) {
            return result;
        }
        if (!sourceIds.isArray()) {
            throw new ReconciliationException(String.format(
                    "Validation rule '%s' has a non-list value %s in %s", ruleName, sourceIds, location));
        }
        for (JsonNode element : sourceIds) {
            String sourceId = Identifiers.asKey(element);
            if (sourceId == null) {
                throw new UnmappedReferenceException(ruleName, location, String.valueOf(element));
            }
            result.add(mapping.targetIdOf(sourceId)
                    .orElseThrow(() -> new UnmappedReferenceException(ruleName, location, sourceId)));
        }
        return result;
    }
}
