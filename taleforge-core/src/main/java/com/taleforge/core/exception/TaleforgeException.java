package com.taleforge.core.exception;

/**
 * Base exception for all turn engine errors.
 */
public class TaleforgeException extends RuntimeException {

    private final String errorCode;

    public TaleforgeException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TaleforgeException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
