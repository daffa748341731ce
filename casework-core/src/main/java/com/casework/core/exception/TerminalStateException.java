package com.casework.core.exception;

import java.util.UUID;

/**
 * Thrown when a transition is attempted from a terminal state.
 */
public class TerminalStateException extends CaseworkException {

    public static final String ERROR_CODE = "TERMINAL_STATE";

    public TerminalStateException(UUID recordId, String stateCode) {
        super(ERROR_CODE, String.format(
            "Record %s is in terminal state '%s' and accepts no transitions",
            recordId, stateCode
        ));
    }
}
