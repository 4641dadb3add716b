package com.kyb.client;

import com.kyb.core.exception.KybException;

/**
 * Raised inside the client when the KYB service call cannot produce a payload.
 * Never leaves the gateway; it is turned into a failed outcome.
 */
public class RiskCheckException extends KybException {

    public static final String ERROR_CODE = "RISK_CHECK_FAILED";

    private final int statusCode;

    public RiskCheckException(String message, int statusCode) {
        super(ERROR_CODE, message);
        this.statusCode = statusCode;
    }

    public RiskCheckException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status of the failed response, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
