package com.kyb.core.exception;

/**
 * Thrown when a customer id is not in the available-customer directory.
 */
public class UnknownCustomerException extends KybException {
    
    public static final String ERROR_CODE = "UNKNOWN_CUSTOMER";
    
    public UnknownCustomerException(String customerId) {
        super(ERROR_CODE, String.format(
            "Customer not available: %s",
            customerId
        ));
    }
}
