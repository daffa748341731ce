package com.casework.core.model;

/**
 * One precondition attached to a transition.
 * Non-mandatory requirements are shown to users but never block a transition.
 */
public record Requirement(
    RequirementKind kind,
    String fieldName,
    int minCount,
    String errorMessage,
    boolean mandatory
) {
    public static Requirement comment() {
        return new Requirement(RequirementKind.COMMENT, null, 0, null, true);
    }

    public static Requirement fieldNotEmpty(String fieldName) {
        return new Requirement(RequirementKind.FIELD_NOT_EMPTY, fieldName, 0, null, true);
    }

    public static Requirement attachment() {
        return new Requirement(RequirementKind.ATTACHMENT, null, 1, null, true);
    }

    public static Requirement minAttachments(int count) {
        return new Requirement(RequirementKind.MIN_ATTACHMENTS, null, count, null, true);
    }

    public static Requirement feedback() {
        return new Requirement(RequirementKind.FEEDBACK, null, 0, null, true);
    }

    public Requirement withErrorMessage(String message) {
        return new Requirement(kind, fieldName, minCount, message, mandatory);
    }

    public Requirement optional() {
        return new Requirement(kind, fieldName, minCount, errorMessage, false);
    }
}
