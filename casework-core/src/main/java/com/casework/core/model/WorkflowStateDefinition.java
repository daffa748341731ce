package com.casework.core.model;

import java.util.UUID;

/**
 * A node in a workflow graph.
 * A null {@code slaHours} means entering this state leaves the SLA deadline untouched.
 */
public record WorkflowStateDefinition(
    UUID id,
    UUID workflowId,
    String code,
    String name,
    boolean initial,
    boolean terminal,
    Integer slaHours,
    int sortOrder
) {
    public static final String RESOLVED_CODE = "resolved";

    public static WorkflowStateDefinition create(
            UUID workflowId,
            String code,
            String name,
            boolean initial,
            boolean terminal,
            Integer slaHours,
            int sortOrder) {
        return new WorkflowStateDefinition(
            UUID.randomUUID(), workflowId, code, name, initial, terminal, slaHours, sortOrder
        );
    }

    public boolean hasSla() {
        return slaHours != null && slaHours > 0;
    }

    /**
     * Entering this state marks the record as resolved as well as closed.
     */
    public boolean isResolution() {
        return terminal && RESOLVED_CODE.equalsIgnoreCase(code);
    }

    public WorkflowStateDefinition withWorkflowId(UUID newWorkflowId) {
        return new WorkflowStateDefinition(
            UUID.randomUUID(), newWorkflowId, code, name, initial, terminal, slaHours, sortOrder
        );
    }
}
