package com.platform.autoheal.error;

/**
 * Base exception for all auto-heal exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class AutoHealException extends RuntimeException {

    private final ErrorCode errorCode;

    protected AutoHealException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    protected AutoHealException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected AutoHealException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
