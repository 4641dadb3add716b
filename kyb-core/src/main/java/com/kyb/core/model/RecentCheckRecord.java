package com.kyb.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of the recent-checks history, written on every successful run.
 */
public record RecentCheckRecord(
    @JsonProperty("customer_id") String customerId,
    @JsonProperty("customer_name") String customerName,
    @JsonProperty("risk_band") RiskBand riskBand,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("trace_id") String traceId
) {
    public RecentCheckRecord {
        Objects.requireNonNull(customerId, "customerId");
        Objects.requireNonNull(riskBand, "riskBand");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(traceId, "traceId");
    }
}
