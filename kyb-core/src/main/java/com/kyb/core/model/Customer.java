package com.kyb.core.model;

import java.util.Objects;

/**
 * A business customer that can be picked on the dashboard.
 */
public record Customer(String customerId, String legalName) {
    public Customer {
        Objects.requireNonNull(customerId, "customerId");
        if (customerId.isBlank()) {
            throw new IllegalArgumentException("customerId must not be blank");
        }
    }

    public String displayName() {
        return legalName != null && !legalName.isBlank() ? legalName : customerId;
    }
}
