package com.casework.core.exception;

import java.util.UUID;

/**
 * Thrown when a workflow cannot be purged because records still reference it.
 */
public class HasDependentRecordsException extends CaseworkException {

    public static final String ERROR_CODE = "HAS_DEPENDENT_RECORDS";

    public HasDependentRecordsException(UUID workflowId, long dependentCount) {
        super(ERROR_CODE, String.format(
            "Workflow %s is still referenced by %d record(s)",
            workflowId, dependentCount
        ));
    }
}
