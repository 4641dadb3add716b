package com.kyb.core.model.result;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TriggerFired(
    @JsonProperty("severity") String severity,
    @JsonProperty("reason") String reason,
    @JsonProperty("code") String code
) {}
