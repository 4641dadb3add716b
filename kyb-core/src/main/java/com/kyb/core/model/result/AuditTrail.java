package com.kyb.core.model.result;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Which KYB agents the service invoked for a run.
 */
public record AuditTrail(
    @JsonProperty("agents_called") List<String> agentsCalled,
    @JsonProperty("customer_id") String customerId,
    @JsonProperty("timestamp") String timestamp
) {
    public AuditTrail {
        agentsCalled = agentsCalled == null ? List.of() : List.copyOf(agentsCalled);
    }
}
