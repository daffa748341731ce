package com.casework.core.exception;

import com.casework.core.model.RequirementViolation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a transition payload fails one or more requirements.
 * Carries every violation, not only the first one.
 */
public class RequirementsNotMetException extends CaseworkException {

    public static final String ERROR_CODE = "REQUIREMENTS_NOT_MET";

    private final List<RequirementViolation> violations;

    public RequirementsNotMetException(List<RequirementViolation> violations) {
        super(ERROR_CODE, "Transition requirements not met: " + violations.stream()
            .map(RequirementViolation::message)
            .collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    public List<RequirementViolation> getViolations() {
        return violations;
    }
}
