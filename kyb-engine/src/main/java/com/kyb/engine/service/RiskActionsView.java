package com.kyb.engine.service;

import com.kyb.core.model.RiskBand;
import com.kyb.core.model.result.ScoreBreakdown;
import com.kyb.core.model.result.SupportingMetrics;
import com.kyb.core.model.result.TriggerFired;

import java.util.List;

/**
 * Risk and actions tab: why the score is what it is and what to do next.
 */
public record RiskActionsView(
    String traceId,
    RiskBand riskBand,
    int score,
    List<TriggerFired> triggersFired,
    ScoreBreakdown scoreBreakdown,
    List<String> candidateTriggers,
    SupportingMetrics supportingMetrics,
    List<String> recommendedActions
) {
    public RiskActionsView {
        triggersFired = triggersFired == null ? List.of() : List.copyOf(triggersFired);
        candidateTriggers = candidateTriggers == null ? List.of() : List.copyOf(candidateTriggers);
        recommendedActions = recommendedActions == null ? List.of() : List.copyOf(recommendedActions);
    }
}
