package com.buildsync.reconcile;

/**
 * Thrown when a validation rule references a field or class id that has no entry in the id mapping.
 * References are never dropped or zeroed; the whole reconciliation stops.
 */
public final class UnmappedReferenceException extends ReconciliationException {

    private final String ruleName;
    private final String location;
    private final String identifier;

    public UnmappedReferenceException(String ruleName, String location, String identifier) {
        super(String.format("Validation rule '%s' references unmapped id %s in %s",
                ruleName, identifier, location));
        this.ruleName = ruleName;
        this.location = location;
        this.identifier = identifier;
    }

    public String getRuleName() {
        return ruleName;
    }

    /** Where the reference sits, e.g. {@code affected_fields} or {@code params.affected_classes}. */
    public String getLocation() {
        return location;
    }

    public String getIdentifier() {
        return identifier;
    }
}
