package com.casework.core.exception;

/**
 * Base exception for all casework errors.
 * The error code is stable and safe to expose to API clients.
 */
public class CaseworkException extends RuntimeException {

    private final String errorCode;

    public CaseworkException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CaseworkException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
