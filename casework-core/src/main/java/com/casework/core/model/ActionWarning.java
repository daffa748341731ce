package com.casework.core.model;

import java.util.UUID;

/**
 * A post-commit action that failed. The transition itself stands.
 */
public record ActionWarning(UUID actionId, ActionType actionType, String message) {
}
