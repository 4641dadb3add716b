package com.kyb.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Relationship manager's manual decision on a completed run.
 * overrideBand is null while the model band stands.
 */
public record RiskDecision(
    @JsonProperty("trace_id") String traceId,
    @JsonProperty("customer_id") String customerId,
    @JsonProperty("model_band") RiskBand modelBand,
    @JsonProperty("override_band") RiskBand overrideBand,
    @JsonProperty("comments") String comments,
    @JsonProperty("updated_at") Instant updatedAt
) {
    public RiskDecision {
        comments = comments == null ? "" : comments;
    }

    @JsonIgnore
    public RiskBand effectiveBand() {
        return overrideBand != null ? overrideBand : modelBand;
    }

    @JsonIgnore
    public boolean isOverridden() {
        return overrideBand != null && overrideBand != modelBand;
    }
}
