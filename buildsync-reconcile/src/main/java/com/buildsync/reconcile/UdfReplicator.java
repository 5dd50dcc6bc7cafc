package com.buildsync.reconcile;

import com.buildsync.model.UdfCatalog;
import com.buildsync.model.UdfDefinition;
import com.buildsync.reconcile.api.BuildProjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Re-creates source UDFs on the target project from the sanitized catalog.
 * Every call creates a new UDF, even for an id replicated before in the same or an earlier run.
 */
public final class UdfReplicator {

    private static final Logger log = LoggerFactory.getLogger(UdfReplicator.class);

    private final BuildProjectWriter target;
    private final String targetProjectId;
    private final UdfCatalog sanitizedUdfs;
    private int created;

    public UdfReplicator(BuildProjectWriter target, String targetProjectId, UdfCatalog sanitizedUdfs) {
        this.target = Objects.requireNonNull(target, "target");
        this.targetProjectId = Objects.requireNonNull(targetProjectId, "targetProjectId");
        this.sanitizedUdfs = sanitizedUdfs != null ? sanitizedUdfs : UdfCatalog.empty();
    }

    /**
     * Creates the UDF with the given source id on the target.
     *
     * @param context where the reference was found, for the error message
     * @return id the target assigned to the new UDF
     * @throws MissingEntityException when the catalog has no UDF with that id
     */
    public String replicate(String sourceUdfId, String context) {
        UdfDefinition udf = sanitizedUdfs.get(sourceUdfId)
                .orElseThrow(() -> new MissingEntityException(EntityKind.UDF, sourceUdfId, context));
        String newId = target.createUdf(targetProjectId, udf.toTree());
        created++;
        log.debug("Created UDF name={} on target project={}: sourceId={} targetId={}",
                udf.getName(), targetProjectId, sourceUdfId, newId);
        return newId;
    }

    /** Number of UDFs created through this replicator. */
    public int getCreatedCount() {
        return created;
    }
}
