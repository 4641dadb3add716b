package com.kyb.core.exception;

/**
 * Thrown when no cached result exists for the requested trace id.
 */
public class ResultNotFoundException extends KybException {
    
    public static final String ERROR_CODE = "RESULT_NOT_FOUND";
    
    public ResultNotFoundException(String traceId) {
        super(ERROR_CODE, String.format(
            "KYB result not found for trace: %s",
            traceId
        ));
    }
}
