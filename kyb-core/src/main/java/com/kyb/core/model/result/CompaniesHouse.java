package com.kyb.core.model.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Registry lookup result. error is set when the lookup could not be completed.
 */
public record CompaniesHouse(
    @JsonProperty("customer_id") String customerId,
    @JsonProperty("error") String error,
    @JsonProperty("message") String message
) {
    @JsonIgnore
    public boolean isAvailable() {
        return error == null;
    }
}
