package com.casework.engine.definition;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of validating a structurally sound workflow.
 * Warnings describe problems that do not block use, such as unreachable states.
 */
public record ValidationReport(UUID workflowId, List<String> warnings) {

    public ValidationReport {
        warnings = List.copyOf(warnings);
    }

    public boolean isClean() {
        return warnings.isEmpty();
    }
}
