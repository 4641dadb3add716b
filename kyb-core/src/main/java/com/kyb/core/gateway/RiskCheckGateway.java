package com.kyb.core.gateway;

import com.kyb.core.model.CheckOutcome;

/**
 * The single network operation of a run.
 * Implementations attach the trace id to the request and never throw:
 * every error resolves to {@link CheckOutcome.Failure}.
 */
@FunctionalInterface
public interface RiskCheckGateway {

    /**
     * Run the KYB check for a customer.
     *
     * @param customerId The customer ID
     * @param traceId Trace id propagated to the service
     * @return Success with the payload, or failure with a message
     */
    CheckOutcome runCheck(String customerId, String traceId);
}
