package com.mouse.smartbet.exception;

import com.mouse.smartbet.enums.ErrorCode;

/**
 * Root of every failure the engine reports. Callers switch on {@link #getErrorCode()}
 * instead of parsing messages.
 */
public abstract class SmartBetException extends RuntimeException {

    private final ErrorCode errorCode;

    protected SmartBetException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected SmartBetException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /** True when the same call may succeed with different input, e.g. a smaller stake. */
    public boolean isRetryable() {
        return false;
    }
}
