package com.buildsync.pipeline;

import com.buildsync.model.SchemaDocument;
import com.buildsync.reconcile.api.BuildProjectWriter;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Counts the calls that completed against the delegate, so a failed run can tell whether the
 * target was already changed.
 */
final class TrackingBuildProjectWriter implements BuildProjectWriter {

    private final BuildProjectWriter delegate;
    private int committed;

    TrackingBuildProjectWriter(BuildProjectWriter delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    int getCommittedCount() {
        return committed;
    }

    boolean hasCommitted() {
        return committed > 0;
    }

    @Override
    public void postSettings(String projectId, JsonNode settings) {
        delegate.postSettings(projectId, settings);
        committed++;
    }

    @Override
    public SchemaDocument postSchema(String projectId, Object schemaPayload) {
        SchemaDocument persisted = delegate.postSchema(projectId, schemaPayload);
        committed++;
        return persisted;
    }

    @Override
    public String postValidation(String projectId, Object validationPayload) {
        String id = delegate.postValidation(projectId, validationPayload);
        committed++;
        return id;
    }

    @Override
    public void deleteValidation(String projectId, String ruleId) {
        delegate.deleteValidation(projectId, ruleId);
        committed++;
    }

    @Override
    public String createUdf(String projectId, JsonNode udf) {
        String id = delegate.createUdf(projectId, udf);
        committed++;
        return id;
    }

    @Override
    public void triggerExamples(String projectId, String udfOrRuleId) {
        delegate.triggerExamples(projectId, udfOrRuleId);
        committed++;
    }

    @Override
    public void triggerCodeGeneration(String projectId, String ruleId) {
        delegate.triggerCodeGeneration(projectId, ruleId);
        committed++;
    }
}
