package com.casework.engine.portability;

import com.casework.core.model.Workflow;

import java.util.List;

/**
 * An imported workflow together with everything that did not carry over cleanly.
 */
public record ImportResult(Workflow workflow, List<String> warnings) {

    public ImportResult {
        warnings = List.copyOf(warnings);
    }

    public boolean isClean() {
        return warnings.isEmpty();
    }
}
