package com.casework.engine.action;

import com.casework.core.model.ActionType;

/**
 * Exception thrown by action handlers on failure.
 * The transition that triggered the action stays committed.
 */
public class ActionException extends Exception {

    public static final String MISCONFIGURED = "ACTION_MISCONFIGURED";
    public static final String TARGET_NOT_FOUND = "ACTION_TARGET_NOT_FOUND";
    public static final String NO_MATCH = "ACTION_NO_MATCH";
    public static final String SELECTION_REQUIRED = "ACTION_SELECTION_REQUIRED";

    private final String errorCode;

    public ActionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ActionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * The action's configuration is missing a key or holds an unusable value.
     */
    public static ActionException misconfigured(ActionType type, String detail) {
        return new ActionException(MISCONFIGURED, String.format("%s action misconfigured: %s", type, detail));
    }
}
