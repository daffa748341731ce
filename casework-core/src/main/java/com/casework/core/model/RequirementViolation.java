package com.casework.core.model;

/**
 * A requirement the payload failed, with a human-readable message.
 */
public record RequirementViolation(RequirementKind kind, String fieldName, String message) {
}
