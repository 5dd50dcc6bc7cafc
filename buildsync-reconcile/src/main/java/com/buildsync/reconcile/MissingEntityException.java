package com.buildsync.reconcile;

/**
 * Thrown when a referenced project, class, field, UDF or rule cannot be found where it is expected
 * (e.g. an extraction line invoking a UDF absent from the source catalog).
 */
public final class MissingEntityException extends ReconciliationException {

    private final EntityKind kind;
    private final String key;

    public MissingEntityException(EntityKind kind, String key, String context) {
        super(String.format("Missing %s '%s'%s", kind, key,
                context != null && !context.isBlank() ? " (" + context + ")" : ""));
        this.kind = kind;
        this.key = key;
    }

    public EntityKind getKind() {
        return kind;
    }

    /** Id or name that could not be resolved. */
    public String getKey() {
        return key;
    }
}
