package com.kyb.core.model.result;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TriggerImpact(
    @JsonProperty("code") String code,
    @JsonProperty("delta") int delta
) {}
