package com.buildsync.reconcile.api;

import com.buildsync.model.SchemaDocument;
import com.buildsync.model.UdfCatalog;
import com.buildsync.model.ValidationDocument;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Read access to the build projects of one environment.
 * Implementations are provided by the runtime (e.g. the HTTP client module); reconciliation never implements it.
 */
public interface BuildProjectReader {

    /** Project listing containing the given project ({@code {"projects": [...]}}). */
    JsonNode fetchSettings(String projectId);

    SchemaDocument fetchSchema(String projectId);

    UdfCatalog fetchUdfs(String projectId);

    ValidationDocument fetchValidations(String projectId);
}
