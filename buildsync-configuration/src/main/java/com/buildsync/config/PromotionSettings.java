package com.buildsync.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Contents of the promotion settings file:
 * <pre>
 * {"source": {"project_id": "..."}, "target": {"project_id": "...", "org": "...", "workspace": "..."}}
 * </pre>
 * Other keys are kept as-is so the file can be rewritten without losing them.
 */
public final class PromotionSettings {

    static final String SOURCE = "source";
    static final String TARGET = "target";
    static final String PROJECT_ID = "project_id";
    static final String ORG = "org";
    static final String WORKSPACE = "workspace";

    private final ObjectNode root;

    public PromotionSettings(JsonNode root) {
        this.root = root != null && root.isObject() ? ((ObjectNode) root).deepCopy() : JsonNodeFactory.instance.objectNode();
    }

    public String getSourceProjectId() {
        return text(SOURCE, PROJECT_ID);
    }

    /** Target project id; {@code null} when the target project has not been created yet. */
    public String getTargetProjectId() {
        return text(TARGET, PROJECT_ID);
    }

    /** Organization the target project is created in. */
    public String getTargetOrg() {
        return text(TARGET, ORG);
    }

    /** Workspace the target project is created in. */
    public String getTargetWorkspace() {
        return text(TARGET, WORKSPACE);
    }

    public boolean hasTargetProject() {
        return getTargetProjectId() != null;
    }

    /** Copy with {@code target.project_id} set. */
    public PromotionSettings withTargetProjectId(String projectId) {
        ObjectNode copy = root.deepCopy();
        JsonNode target = copy.get(TARGET);
        ObjectNode targetNode = target != null && target.isObject() ? (ObjectNode) target : copy.putObject(TARGET);
        targetNode.put(PROJECT_ID, projectId);
        return new PromotionSettings(copy);
    }

    public ObjectNode toTree() {
        return root.deepCopy();
    }

    private String text(String section, String key) {
        JsonNode value = root.path(section).path(key);
        if (value.isMissingNode() || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    @Override
    public String toString() {
        return "PromotionSettings{source=" + getSourceProjectId() + ", target=" + getTargetProjectId() + "}";
    }
}
