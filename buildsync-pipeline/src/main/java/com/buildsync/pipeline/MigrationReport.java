package com.buildsync.pipeline;

import java.util.List;

/**
 * Outcome of a successful migration run.
 */
public final class MigrationReport {

    private final String targetProjectId;
    private final boolean projectCreated;
    private final MigrationStage stage;
    private final int classesUpdated;
    private final int classesAdded;
    private final int createdUdfCount;
    private final List<String> validationIds;

    MigrationReport(String targetProjectId, boolean projectCreated, MigrationStage stage,
                    int classesUpdated, int classesAdded, int createdUdfCount, List<String> validationIds) {
        this.targetProjectId = targetProjectId;
        this.projectCreated = projectCreated;
        this.stage = stage;
        this.classesUpdated = classesUpdated;
        this.classesAdded = classesAdded;
        this.createdUdfCount = createdUdfCount;
        this.validationIds = List.copyOf(validationIds);
    }

    public String getTargetProjectId() {
        return targetProjectId;
    }

    /** Whether the run created the target project. */
    public boolean isProjectCreated() {
        return projectCreated;
    }

    public MigrationStage getStage() {
        return stage;
    }

    public int getClassesUpdated() {
        return classesUpdated;
    }

    public int getClassesAdded() {
        return classesAdded;
    }

    /** UDFs created on the target by schema and validation reconciliation together. */
    public int getCreatedUdfCount() {
        return createdUdfCount;
    }

    /** Ids of the persisted validation rules, in source order. */
    public List<String> getValidationIds() {
        return validationIds;
    }

    @Override
    public String toString() {
        return "MigrationReport{target=" + targetProjectId + ", created=" + projectCreated + ", stage=" + stage
                + ", classesUpdated=" + classesUpdated + ", classesAdded=" + classesAdded
                + ", udfs=" + createdUdfCount + ", validations=" + validationIds.size() + "}";
    }
}
