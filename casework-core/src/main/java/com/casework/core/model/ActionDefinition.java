package com.casework.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.UUID;

/**
 * An action attached to a transition. The shape of {@code config} depends on the type.
 */
public record ActionDefinition(
    UUID id,
    ActionType type,
    int executionOrder,
    boolean active,
    JsonNode config
) {
    public ActionDefinition {
        config = config == null ? JsonNodeFactory.instance.objectNode() : config;
    }

    public static ActionDefinition create(ActionType type, int executionOrder, JsonNode config) {
        return new ActionDefinition(UUID.randomUUID(), type, executionOrder, true, config);
    }

    public ActionDefinition inactive() {
        return new ActionDefinition(id, type, executionOrder, false, config);
    }

    public ActionDefinition withFreshId() {
        return new ActionDefinition(UUID.randomUUID(), type, executionOrder, active, config);
    }
}
