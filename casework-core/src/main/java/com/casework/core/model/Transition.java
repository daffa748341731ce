package com.casework.core.model;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A directed, guarded edge between two states of the same workflow.
 * Empty {@code allowedRoles} means any authenticated role may execute it.
 */
public record Transition(
    UUID id,
    UUID workflowId,
    String code,
    String name,
    UUID fromStateId,
    UUID toStateId,
    List<Requirement> requirements,
    List<ActionDefinition> actions,
    Set<String> allowedRoles,
    boolean active,
    int sortOrder
) {
    public Transition {
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
        actions = actions == null ? List.of() : List.copyOf(actions);
        allowedRoles = allowedRoles == null ? Set.of() : Set.copyOf(allowedRoles);
    }

    public static Transition create(
            UUID workflowId,
            String code,
            String name,
            UUID fromStateId,
            UUID toStateId,
            List<Requirement> requirements,
            List<ActionDefinition> actions,
            Set<String> allowedRoles) {
        return new Transition(
            UUID.randomUUID(), workflowId, code, name, fromStateId, toStateId,
            requirements, actions, allowedRoles, true, 0
        );
    }

    /**
     * Whether the actor may execute this transition. Super-admins bypass role checks.
     */
    public boolean permits(Actor actor) {
        return actor.superAdmin() || allowedRoles.isEmpty() || actor.hasAnyRole(allowedRoles);
    }

    /**
     * Active actions in execution order.
     */
    public List<ActionDefinition> orderedActions() {
        return actions.stream()
            .filter(ActionDefinition::active)
            .sorted(Comparator.comparingInt(ActionDefinition::executionOrder))
            .toList();
    }

    public Transition withActive(boolean newActive) {
        return new Transition(
            id, workflowId, code, name, fromStateId, toStateId,
            requirements, actions, allowedRoles, newActive, sortOrder
        );
    }

    public Transition withSortOrder(int newSortOrder) {
        return new Transition(
            id, workflowId, code, name, fromStateId, toStateId,
            requirements, actions, allowedRoles, active, newSortOrder
        );
    }

    /**
     * Copy into another workflow with remapped endpoints and fresh ids.
     */
    public Transition copyInto(UUID newWorkflowId, UUID newFromStateId, UUID newToStateId) {
        return new Transition(
            UUID.randomUUID(), newWorkflowId, code, name, newFromStateId, newToStateId,
            requirements,
            actions.stream().map(ActionDefinition::withFreshId).toList(),
            allowedRoles, active, sortOrder
        );
    }
}
