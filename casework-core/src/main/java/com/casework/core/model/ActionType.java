package com.casework.core.model;

/**
 * Side effects a transition can trigger after it commits.
 */
public enum ActionType {
    ASSIGN_USER,
    ASSIGN_ROLE,
    ASSIGN_DEPARTMENT,
    SET_FIELD,
    RECOMPUTE_SLA,
    CHANGE_RECORD_TYPE,
    NOTIFY
}
