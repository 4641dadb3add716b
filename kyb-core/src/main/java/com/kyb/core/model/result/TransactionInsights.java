package com.kyb.core.model.result;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TransactionInsights(
    @JsonProperty("summary") String summary,
    @JsonProperty("candidate_triggers") List<String> candidateTriggers,
    @JsonProperty("supporting_metrics") SupportingMetrics supportingMetrics
) {
    public TransactionInsights {
        candidateTriggers = candidateTriggers == null ? List.of() : List.copyOf(candidateTriggers);
    }
}
