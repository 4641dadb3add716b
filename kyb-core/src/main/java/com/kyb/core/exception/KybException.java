package com.kyb.core.exception;

/**
 * Base exception for all dashboard errors.
 */
public class KybException extends RuntimeException {
    
    private final String errorCode;
    
    public KybException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public KybException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
