package com.buildsync.model;

/**
 * Kind of a validation rule (the rule's {@code type}). Kinds that embed references other than
 * field ids get dedicated handling during reconciliation; everything else is {@link #OTHER}.
 */
public enum ValidationKind {
    FIELD_CONFIDENCE,
    /** {@code params.affected_classes} holds class ids. */
    CLASS_CONFIDENCE,
    /** {@code params.udf_id} references a UDF. */
    UDF,
    /** UDF-backed rule whose code is generated from a prompt on the target. */
    PROMPT_UDF,
    OTHER;

    public static ValidationKind fromType(String type) {
        if (type == null || type.isBlank()) {
            return OTHER;
        }
        for (ValidationKind kind : values()) {
            if (kind != OTHER && kind.name().equals(type.trim())) {
                return kind;
            }
        }
        return OTHER;
    }

    public boolean isUdfBacked() {
        return this == UDF || this == PROMPT_UDF;
    }
}
