package com.buildsync.reconcile;

/** Kinds of entities a reconciliation looks up by id or name. */
public enum EntityKind {
    PROJECT,
    CLASS,
    FIELD,
    UDF,
    VALIDATION_RULE
}
