package com.buildsync.pipeline;

/**
 * Thrown when a migration run fails after it already changed the target project. The target is left
 * part-migrated; {@link #getLastCompletedStage()} tells how far the run got and the cause is the
 * original failure.
 */
public final class PartialMigrationException extends RuntimeException {

    private final String targetProjectId;
    private final MigrationStage lastCompletedStage;
    private final int committedCalls;

    public PartialMigrationException(String targetProjectId, MigrationStage lastCompletedStage,
                                     int committedCalls, RuntimeException cause) {
        super(String.format("Target project %s is part-migrated (last completed stage: %s, %d change(s) committed): %s",
                targetProjectId, lastCompletedStage != null ? lastCompletedStage : "none", committedCalls,
                cause.getMessage()), cause);
        this.targetProjectId = targetProjectId;
        this.lastCompletedStage = lastCompletedStage;
        this.committedCalls = committedCalls;
    }

    public String getTargetProjectId() {
        return targetProjectId;
    }

    /** Last completed stage, or {@code null} when the run failed before {@link MigrationStage#FETCHED}. */
    public MigrationStage getLastCompletedStage() {
        return lastCompletedStage;
    }

    /** Number of target calls that completed before the failure. */
    public int getCommittedCalls() {
        return committedCalls;
    }
}
