package com.casework.core.exception;

import java.util.Set;

/**
 * Thrown when none of the caller's roles is allowed to execute a transition.
 */
public class ForbiddenException extends CaseworkException {

    public static final String ERROR_CODE = "FORBIDDEN";

    public ForbiddenException(String transitionCode, Set<String> allowedRoles) {
        super(ERROR_CODE, String.format(
            "Transition '%s' requires one of the roles %s",
            transitionCode, allowedRoles
        ));
    }

    public ForbiddenException(String message) {
        super(ERROR_CODE, message);
    }
}
