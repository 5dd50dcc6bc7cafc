package com.buildsync.reconcile;

import com.buildsync.model.UdfCatalog;
import com.buildsync.model.UdfDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strips per-environment metadata from UDF definitions so they can be re-created in another environment.
 * Returns a new catalog; the input is never modified.
 */
public final class UdfSanitizer {

    /** Attributes that only make sense in the environment the UDF was read from. */
    public static final List<String> VOLATILE_ATTRIBUTES = List.of(
            "docstring",
            "last_updated_at",
            "lambda_id",
            "lambda_udf_id",
            "lambda_end_of_life");

    public static final String FORCED_RETURN_TYPE = "string";

    public UdfCatalog sanitize(UdfCatalog allUdfs) {
        if (allUdfs == null) {
            return UdfCatalog.empty();
        }
        Map<String, UdfDefinition> sanitized = new LinkedHashMap<>();
        allUdfs.asMap().forEach((id, udf) -> sanitized.put(id, sanitize(udf)));
        return new UdfCatalog(sanitized);
    }

    public UdfDefinition sanitize(UdfDefinition udf) {
        return udf.without(VOLATILE_ATTRIBUTES).withReturnType(FORCED_RETURN_TYPE);
    }
}
