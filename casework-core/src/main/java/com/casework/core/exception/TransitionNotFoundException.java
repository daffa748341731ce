package com.casework.core.exception;

import java.util.UUID;

/**
 * Thrown when a transition does not exist or does not belong to the record's workflow.
 * Also raised when the transition was removed while a request was in flight.
 */
public class TransitionNotFoundException extends NotFoundException {

    public static final String ERROR_CODE = "TRANSITION_NOT_FOUND";

    public TransitionNotFoundException(UUID transitionId) {
        super(ERROR_CODE, "Transition", transitionId);
    }
}
