package com.kyb.core.model.result;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record PartySummary(
    @JsonProperty("parties") List<Party> parties,
    @JsonProperty("key_observations") String keyObservations
) {
    public PartySummary {
        parties = parties == null ? List.of() : List.copyOf(parties);
    }
}
