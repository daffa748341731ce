package com.casework.core.model;

import java.util.List;
import java.util.UUID;

/**
 * A transition the caller may execute from the record's current state.
 */
public record AvailableTransition(
    UUID transitionId,
    String code,
    String name,
    UUID toStateId,
    String toStateCode,
    List<Requirement> requirements
) {
}
