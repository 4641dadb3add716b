package com.kyb.core.model.result;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.kyb.core.model.RiskBand;

import java.util.List;

public record RiskAssessment(
    @JsonProperty("score") int score,
    @JsonProperty("risk_band") RiskBand riskBand,
    @JsonProperty("score_breakdown") ScoreBreakdown scoreBreakdown,
    @JsonProperty("triggers_fired") List<TriggerFired> triggersFired,
    @JsonProperty("overall_reasoning") String overallReasoning,
    @JsonProperty("journey_type") String journeyType
) {
    public RiskAssessment {
        riskBand = riskBand == null ? RiskBand.GREEN : riskBand;
        triggersFired = triggersFired == null ? List.of() : List.copyOf(triggersFired);
    }
}
