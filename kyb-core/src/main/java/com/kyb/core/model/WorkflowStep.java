package com.kyb.core.model;

import java.util.List;

/**
 * Simulated KYB workflow steps, declared in canonical order.
 */
public enum WorkflowStep {
    JOURNEY_CLASSIFIER("Journey Classifier"),
    ENTITY_PARTIES("Entity & Parties"),
    TRANSACTIONS_INSIGHTS("Transactions Insights"),
    COMPANIES_HOUSE("Companies House"),
    RISK_RULES("Risk & Rules"),
    KYB_SUMMARY_NOTE("KYB Summary Note");

    private static final List<WorkflowStep> CANONICAL_ORDER = List.of(values());

    private final String displayName;

    WorkflowStep(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * All steps in the order a run completes them.
     */
    public static List<WorkflowStep> canonicalOrder() {
        return CANONICAL_ORDER;
    }

    /**
     * Check if this is the final step of a run.
     */
    public boolean isLast() {
        return ordinal() == CANONICAL_ORDER.size() - 1;
    }

    /**
     * Check that the given steps are a prefix of the canonical order.
     */
    public static boolean isCanonicalPrefix(List<WorkflowStep> steps) {
        if (steps.size() > CANONICAL_ORDER.size()) {
            return false;
        }
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i) != CANONICAL_ORDER.get(i)) {
                return false;
            }
        }
        return true;
    }
}
