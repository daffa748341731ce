package com.casework.core.exception;

import java.util.UUID;

/**
 * Thrown when the workflow graph does not permit the requested operation:
 * a transition whose from-state is not the record's current state,
 * a workflow without exactly one initial state, or an edge crossing workflows.
 */
public class InvalidTopologyException extends CaseworkException {

    public static final String ERROR_CODE = "INVALID_TOPOLOGY";

    public InvalidTopologyException(String message) {
        super(ERROR_CODE, message);
    }

    public InvalidTopologyException(UUID transitionId, UUID fromStateId, UUID currentStateId) {
        super(ERROR_CODE, String.format(
            "Transition %s starts from state %s but record is in state %s",
            transitionId, fromStateId, currentStateId
        ));
    }

    public static InvalidTopologyException noInitialState(UUID workflowId) {
        return new InvalidTopologyException("Workflow has no initial state configured: " + workflowId);
    }
}
