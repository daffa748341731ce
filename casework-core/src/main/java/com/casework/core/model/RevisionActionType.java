package com.casework.core.model;

/**
 * Kinds of audited mutations.
 */
public enum RevisionActionType {
    CREATED,
    FIELD_CHANGED,
    TRANSITIONED,
    COMMENT_ADDED,
    ATTACHMENT_ADDED,
    ASSIGNEE_CHANGED,
    RECORD_TYPE_CHANGED,
    SLA_BREACHED,
    ACTION_FAILED
}
