package com.casework.engine.record;

import com.casework.core.model.CaseRecord;

import java.util.Set;

/**
 * Names of the record attributes that may be written as plain fields.
 * Anything that is neither built-in nor protected is stored as a custom field.
 */
public final class RecordFields {

    /**
     * Attributes owned by the engine. State and workflow move only through transitions.
     */
    public static final Set<String> PROTECTED = Set.of(
        "id", "recordNumber", "recordType", "workflowId", "currentStateId", "version",
        "slaDueAt", "slaBreached", "sourceRecordId", "resolvedAt", "closedAt", "createdAt", "updatedAt"
    );

    public static final Set<String> BUILT_IN = Set.of(
        "title", "description", "priority", "severity", "channel",
        "classificationId", "departmentId", "locationId", "assigneeId", "reporterId"
    );

    private RecordFields() {
    }

    public static boolean isProtected(String field) {
        return PROTECTED.contains(field);
    }

    /**
     * Set a built-in or custom field on the builder.
     *
     * @throws IllegalArgumentException if the field is protected
     */
    public static CaseRecord.Builder set(CaseRecord.Builder builder, String field, String value) {
        if (isProtected(field)) {
            throw new IllegalArgumentException("Field cannot be written directly: " + field);
        }
        return switch (field) {
            case "title" -> builder.title(value);
            case "description" -> builder.description(value);
            case "priority" -> builder.priority(value);
            case "severity" -> builder.severity(value);
            case "channel" -> builder.channel(value);
            case "classificationId" -> builder.classificationId(value);
            case "departmentId" -> builder.departmentId(value);
            case "locationId" -> builder.locationId(value);
            case "assigneeId" -> builder.assigneeId(value);
            case "reporterId" -> builder.reporterId(value);
            default -> builder.customField(field, value);
        };
    }
}
