package com.buildsync.reconcile;

import com.buildsync.model.SchemaDocument;
import com.buildsync.reconcile.api.BuildProjectWriter;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/** Writer that records every call in order and hands out sequential UDF ids starting at 100. */
class RecordingBuildProjectWriter implements BuildProjectWriter {

    final List<String> calls = new ArrayList<>();
    final List<JsonNode> createdUdfs = new ArrayList<>();
    private int nextUdfId = 100;

    @Override
    public void postSettings(String projectId, JsonNode settings) {
        calls.add("postSettings:" + projectId);
    }

    @Override
    public SchemaDocument postSchema(String projectId, Object schemaPayload) {
        calls.add("postSchema:" + projectId);
        return SchemaDocument.empty();
    }

    @Override
    public String postValidation(String projectId, Object validationPayload) {
        calls.add("postValidation:" + projectId);
        return "1";
    }

    @Override
    public void deleteValidation(String projectId, String ruleId) {
        calls.add("deleteValidation:" + ruleId);
    }

    @Override
    public String createUdf(String projectId, JsonNode udf) {
        createdUdfs.add(udf);
        String id = String.valueOf(nextUdfId++);
        calls.add("createUdf:" + id);
        return id;
    }

    @Override
    public void triggerExamples(String projectId, String udfOrRuleId) {
        calls.add("triggerExamples:" + udfOrRuleId);
    }

    @Override
    public void triggerCodeGeneration(String projectId, String ruleId) {
        calls.add("triggerCodeGeneration:" + ruleId);
    }
}
