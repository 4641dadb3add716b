package com.kyb.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.kyb.core.model.result.KybRunResult;

import java.time.Instant;
import java.util.Objects;

/**
 * The most recent successful payload, kept so detail views never re-fetch.
 */
public record CachedResult(
    @JsonProperty("trace_id") String traceId,
    @JsonProperty("customer_id") String customerId,
    @JsonProperty("result") KybRunResult result,
    @JsonProperty("cached_at") Instant cachedAt
) {
    public CachedResult {
        Objects.requireNonNull(traceId, "traceId");
        Objects.requireNonNull(customerId, "customerId");
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(cachedAt, "cachedAt");
    }

    public boolean belongsTo(String otherTraceId) {
        return traceId.equals(otherTraceId);
    }
}
