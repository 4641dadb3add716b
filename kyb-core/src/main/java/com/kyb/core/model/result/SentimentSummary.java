package com.kyb.core.model.result;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SentimentSummary(
    @JsonProperty("positive") int positive,
    @JsonProperty("neutral") int neutral,
    @JsonProperty("negative") int negative,
    @JsonProperty("total") int total
) {}
