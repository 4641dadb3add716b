package com.kyb.core.model.result;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record Party(
    @JsonProperty("role") String role,
    @JsonProperty("party_id") String partyId,
    @JsonProperty("risk_label") String riskLabel,
    @JsonProperty("name") String name,
    @JsonProperty("key_flags") List<String> keyFlags
) {
    public Party {
        keyFlags = keyFlags == null ? List.of() : List.copyOf(keyFlags);
    }
}
