package com.casework.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable audit entry for a record mutation.
 * Append-only; only retention cleanup removes revisions.
 *
 * Index: (recordId, revisionNumber)
 */
public record Revision(
    UUID id,
    UUID recordId,
    long revisionNumber,
    RevisionActionType actionType,
    String performedBy,
    Instant timestamp,
    String description,
    JsonNode payloadSnapshot
) {
    /**
     * Create a revision. The repository assigns the revision number on append.
     */
    public static Revision create(
            UUID recordId,
            RevisionActionType actionType,
            String performedBy,
            Instant timestamp,
            String description,
            JsonNode payloadSnapshot) {
        return new Revision(
            UUID.randomUUID(),
            recordId,
            0L,
            actionType,
            performedBy,
            timestamp,
            description,
            payloadSnapshot
        );
    }

    public Revision withRevisionNumber(long number) {
        return new Revision(
            id, recordId, number, actionType, performedBy, timestamp, description, payloadSnapshot
        );
    }
}
