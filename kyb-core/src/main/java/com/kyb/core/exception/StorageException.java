package com.kyb.core.exception;

/**
 * Thrown when local persistence cannot be read or written.
 */
public class StorageException extends KybException {
    
    public static final String ERROR_CODE = "STORAGE_FAILURE";
    
    public StorageException(String key, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Failed to access stored value '%s': %s",
            key, cause.getMessage()
        ), cause);
    }
}
