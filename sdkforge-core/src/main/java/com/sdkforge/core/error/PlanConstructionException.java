package com.sdkforge.core.error;

/**
 * Thrown by a declaration builder when a design-plan fragment lacks a field needed to build
 * its AST node, or when a field yields an identifier that cannot be declared.
 *
 * <p>Fragments built before the failing one are unaffected; the exception only carries the
 * identity of the fragment that could not be built.
 */
public final class PlanConstructionException extends CodeGenerationException {

    private static final long serialVersionUID = 1L;

    private final String entityType;
    private final String entityId;
    private final String missingField;

    /**
     * Creates a construction error.
     *
     * @param entityType plan entity type (e.g. "method", "error", "type")
     * @param entityId entity identifier (name, code or position)
     * @param missingField name of the missing field
     */
    public PlanConstructionException(String entityType, String entityId, String missingField) {
        super("Cannot build " + entityType + " '" + entityId + "': missing required field '"
            + missingField + "'");
        this.entityType = entityType;
        this.entityId = entityId;
        this.missingField = missingField;
    }

    /**
     * Creates a construction error for a field that is present but unusable.
     *
     * @param entityType plan entity type
     * @param entityId entity identifier
     * @param field name of the offending field
     * @param problem what is wrong with the field value
     */
    public PlanConstructionException(String entityType, String entityId, String field, String problem) {
        super("Cannot build " + entityType + " '" + entityId + "': field '" + field + "' " + problem);
        this.entityType = entityType;
        this.entityId = entityId;
        this.missingField = field;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }

    /**
     * Returns the missing or unusable field.
     *
     * @return field name
     */
    public String getMissingField() {
        return missingField;
    }
}
