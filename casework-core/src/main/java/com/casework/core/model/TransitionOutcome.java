package com.casework.core.model;

import java.util.List;

/**
 * Result of a committed transition: the record after all actions ran,
 * the history entry, and warnings from failed actions.
 */
public record TransitionOutcome(
    CaseRecord record,
    TransitionHistoryEntry historyEntry,
    List<ActionWarning> warnings
) {
    public TransitionOutcome {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
