package com.casework.core.model;

/**
 * Lifecycle of a workflow definition.
 * Transitions: ACTIVE -> SOFT_DELETED -> PURGED, SOFT_DELETED -> ACTIVE (restore).
 */
public enum WorkflowLifecycle {
    /**
     * Visible to matching and usable for new records.
     */
    ACTIVE,

    /**
     * Hidden from matching and listings; existing records keep working.
     * Transitions: -> ACTIVE, PURGED
     */
    SOFT_DELETED,

    /**
     * Removed permanently. Terminal state.
     */
    PURGED;

    public boolean isTerminal() {
        return this == PURGED;
    }

    public boolean canTransitionTo(WorkflowLifecycle target) {
        return switch (this) {
            case ACTIVE -> target == SOFT_DELETED;
            case SOFT_DELETED -> target == ACTIVE || target == PURGED;
            case PURGED -> false;
        };
    }
}
