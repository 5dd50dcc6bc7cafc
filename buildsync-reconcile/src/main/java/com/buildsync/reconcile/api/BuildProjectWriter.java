package com.buildsync.reconcile.api;

import com.buildsync.model.SchemaDocument;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Write access to the build projects of one environment. Every call commits a side effect on that
 * environment; none of them is idempotent and none is rolled back by the caller.
 */
public interface BuildProjectWriter {

    void postSettings(String projectId, JsonNode settings);

    /**
     * Persists a reconciled schema payload.
     *
     * @return the schema as persisted, with the ids the environment assigned to new classes and fields
     */
    SchemaDocument postSchema(String projectId, Object schemaPayload);

    /** @return id of the persisted rule */
    String postValidation(String projectId, Object validationPayload);

    void deleteValidation(String projectId, String ruleId);

    /** @return id the environment assigned to the new UDF */
    String createUdf(String projectId, JsonNode udf);

    /** Starts example generation for a UDF or UDF-backed rule. */
    void triggerExamples(String projectId, String udfOrRuleId);

    /** Starts code generation for a persisted prompt-UDF rule. */
    void triggerCodeGeneration(String projectId, String ruleId);
}
