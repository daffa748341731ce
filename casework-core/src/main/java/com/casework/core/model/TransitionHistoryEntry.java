package com.casework.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of one executed transition.
 */
public record TransitionHistoryEntry(
    UUID id,
    UUID recordId,
    UUID transitionId,
    UUID fromStateId,
    UUID toStateId,
    String performedBy,
    Instant timestamp,
    String comment
) {
    public static TransitionHistoryEntry create(
            UUID recordId,
            Transition transition,
            String performedBy,
            Instant timestamp,
            String comment) {
        return new TransitionHistoryEntry(
            UUID.randomUUID(),
            recordId,
            transition.id(),
            transition.fromStateId(),
            transition.toStateId(),
            performedBy,
            timestamp,
            comment
        );
    }
}
