package com.kyb.core.model.result;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Base score plus the delta each fired trigger contributed.
 */
public record ScoreBreakdown(
    @JsonProperty("trigger_impacts") List<TriggerImpact> triggerImpacts,
    @JsonProperty("base_score") int baseScore
) {
    public ScoreBreakdown {
        triggerImpacts = triggerImpacts == null ? List.of() : List.copyOf(triggerImpacts);
    }

    public int totalDelta() {
        return triggerImpacts.stream().mapToInt(TriggerImpact::delta).sum();
    }
}
