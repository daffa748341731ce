package com.casework.core.exception;

/**
 * Thrown when a workflow, state, transition or record is missing.
 */
public class NotFoundException extends CaseworkException {

    public static final String ERROR_CODE = "NOT_FOUND";

    private final String entityType;
    private final String entityId;

    public NotFoundException(String entityType, Object entityId) {
        this(ERROR_CODE, entityType, entityId);
    }

    protected NotFoundException(String errorCode, String entityType, Object entityId) {
        super(errorCode, String.format("%s not found: %s", entityType, entityId));
        this.entityType = entityType;
        this.entityId = String.valueOf(entityId);
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }
}
