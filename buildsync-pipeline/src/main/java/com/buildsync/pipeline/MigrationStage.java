package com.buildsync.pipeline;

/**
 * Stages of a migration run, in execution order. A run reports the last stage it completed.
 */
public enum MigrationStage {
    /** Source settings, UDFs, schema and validations read. */
    FETCHED,
    SCHEMA_RECONCILED,
    /** Schema posted to the target; the target now holds the merged schema. */
    SCHEMA_PERSISTED,
    IDS_MAPPED,
    VALIDATIONS_RECONCILED,
    /** All validation rules posted and prompt-UDF code generation triggered. */
    VALIDATIONS_PERSISTED
}
