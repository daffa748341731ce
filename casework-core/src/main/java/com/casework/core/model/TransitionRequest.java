package com.casework.core.model;

import java.util.UUID;

/**
 * Request to move a record along a transition.
 * {@code expectedVersion} is the record version the caller last read.
 */
public record TransitionRequest(
    UUID recordId,
    UUID transitionId,
    long expectedVersion,
    Actor actor,
    TransitionPayload payload
) {
    public TransitionRequest {
        payload = payload == null ? TransitionPayload.empty() : payload;
    }
}
