package com.casework.core.model;

/**
 * Preconditions a transition payload must satisfy.
 */
public enum RequirementKind {
    /** Non-blank comment. */
    COMMENT,
    /** Named field non-blank in the payload, falling back to the record. */
    FIELD_NOT_EMPTY,
    /** At least one attachment. */
    ATTACHMENT,
    /** At least {@code minCount} attachments. */
    MIN_ATTACHMENTS,
    /** Feedback rating between 1 and 5. */
    FEEDBACK
}
