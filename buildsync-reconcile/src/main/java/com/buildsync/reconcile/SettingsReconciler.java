package com.buildsync.reconcile;

import com.buildsync.model.Identifiers;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Extracts a project's settings from a project listing so they can be applied to another project.
 * Identity and location attributes of the source project are removed.
 */
public final class SettingsReconciler {

    /** Attributes that belong to the source project itself. */
    public static final List<String> PROJECT_LOCAL_ATTRIBUTES = List.of(
            "id", "project_root", "data_root", "workspace", "name");

    /**
     * @param settingsDocument listing {@code {"projects": [{"id": ..., ...}, ...]}}
     * @param sourceProjectId  project to take the settings from
     * @return settings without project-local attributes
     * @throws MissingEntityException when the listing has no project with that id
     */
    public ObjectNode reconcile(JsonNode settingsDocument, String sourceProjectId) {
        JsonNode project = findProject(settingsDocument, sourceProjectId);
        ObjectNode settings = ((ObjectNode) project).deepCopy();
        settings.remove(PROJECT_LOCAL_ATTRIBUTES);
        return settings;
    }

    /** Name of the project with the given id in the listing. */
    public String projectName(JsonNode settingsDocument, String projectId) {
        JsonNode name = findProject(settingsDocument, projectId).get("name");
        if (name == null || name.isNull() || name.asText().isBlank()) {
            throw new MissingEntityException(EntityKind.PROJECT, projectId, "project has no name");
        }
        return name.asText();
    }

    private static JsonNode findProject(JsonNode settingsDocument, String projectId) {
        JsonNode projects = settingsDocument != null ? settingsDocument.get("projects") : null;
        if (projects != null && projects.isArray()) {
            for (JsonNode project : projects) {
                if (project.isObject() && projectId != null && projectId.equals(Identifiers.asKey(project.get("id")))) {
                    return project;
                }
            }
        }
        throw new MissingEntityException(EntityKind.PROJECT, projectId, "not in project settings listing");
    }
}
