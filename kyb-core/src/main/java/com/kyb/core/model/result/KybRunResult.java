package com.kyb.core.model.result;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.kyb.core.model.RiskBand;

import java.util.List;

/**
 * Payload returned by the KYB service for one run.
 * The run workflow reads only the risk band and the entity's legal name;
 * everything else is carried through to the detail views.
 */
public record KybRunResult(
    @JsonProperty("_audit_trail") AuditTrail auditTrail,
    @JsonProperty("transaction_insights") TransactionInsights transactionInsights,
    @JsonProperty("recommended_actions") List<String> recommendedActions,
    @JsonProperty("kyb_note") String kybNote,
    @JsonProperty("risk_assessment") RiskAssessment riskAssessment,
    @JsonProperty("entity_profile") EntityProfile entityProfile,
    @JsonProperty("group_context") String groupContext,
    @JsonProperty("journey_type") String journeyType,
    @JsonProperty("party_summary") PartySummary partySummary,
    @JsonProperty("organization_structure") String organizationStructure,
    @JsonProperty("companies_house") CompaniesHouse companiesHouse,
    @JsonProperty("sentiment_analysis") SentimentAnalysis sentimentAnalysis
) {
    public KybRunResult {
        recommendedActions = recommendedActions == null ? List.of() : List.copyOf(recommendedActions);
    }

    /**
     * Band from the risk assessment, GREEN when the assessment is missing.
     */
    public RiskBand riskBand() {
        return riskAssessment != null ? riskAssessment.riskBand() : RiskBand.GREEN;
    }

    /**
     * Display name for recent-check history, falling back to the given customer id.
     */
    public String displayName(String fallback) {
        if (entityProfile != null && entityProfile.legalName() != null && !entityProfile.legalName().isBlank()) {
            return entityProfile.legalName();
        }
        return fallback;
    }
}
