package com.casework.core.exception;

import com.casework.core.model.WorkflowLifecycle;

/**
 * Thrown when a workflow lifecycle change is not allowed.
 */
public class LifecycleTransitionException extends CaseworkException {

    public static final String ERROR_CODE = "INVALID_LIFECYCLE_TRANSITION";

    public LifecycleTransitionException(WorkflowLifecycle current, WorkflowLifecycle target) {
        super(ERROR_CODE, String.format(
            "Cannot move workflow from %s to %s",
            current, target
        ));
    }
}
