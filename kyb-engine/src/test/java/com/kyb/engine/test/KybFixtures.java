package com.kyb.engine.test;

import com.kyb.core.model.RiskBand;
import com.kyb.core.model.result.AuditTrail;
import com.kyb.core.model.result.CompaniesHouse;
import com.kyb.core.model.result.EntityProfile;
import com.kyb.core.model.result.KybRunResult;
import com.kyb.core.model.result.Party;
import com.kyb.core.model.result.PartySummary;
import com.kyb.core.model.result.RiskAssessment;
import com.kyb.core.model.result.ScoreBreakdown;
import com.kyb.core.model.result.SentimentAnalysis;
import com.kyb.core.model.result.SentimentSummary;
import com.kyb.core.model.result.SupportingMetrics;
import com.kyb.core.model.result.TransactionInsights;
import com.kyb.core.model.result.TriggerFired;
import com.kyb.core.model.result.TriggerImpact;

import java.util.List;

/**
 * Payload builders for tests.
 */
public final class KybFixtures {

    public static final String LEGAL_NAME = "ABC Exports Private Limited";

    private KybFixtures() {
    }

    public static KybRunResult result(String customerId, RiskBand band) {
        return result(customerId, LEGAL_NAME, band);
    }

    public static KybRunResult result(String customerId, String legalName, RiskBand band) {
        return new KybRunResult(
            new AuditTrail(List.of("journey_classifier", "entity_parties", "risk_rules"), customerId, "2025-01-15T10:30:00Z"),
            new TransactionInsights(
                "Outward international payments rose sharply in the latest quarter.",
                List.of("INTL_OUTWARD_SPIKE"),
                new SupportingMetrics("2024-Q4", 12, 45, 8, 12)),
            List.of("Request source-of-funds evidence", "Schedule enhanced review"),
            "Elevated international activity; review recommended.",
            new RiskAssessment(
                62,
                band,
                new ScoreBreakdown(List.of(new TriggerImpact("INTL_OUTWARD_SPIKE", 20)), 42),
                List.of(new TriggerFired("HIGH", "International outward payments up 45%", "INTL_OUTWARD_SPIKE")),
                "Score driven by a spike in international outward payments.",
                "PERIODIC_REVIEW"),
            new EntityProfile(customerId, legalName, "Textiles", "IN", "IN", "2019-04-01",
                "VERIFIED", "50-100 Cr", "2023-06-30", "SATISFACTORY", "PERIODIC_REVIEW"),
            "Standalone entity",
            "PERIODIC_REVIEW",
            new PartySummary(
                List.of(new Party("DIRECTOR", "P-001", "LOW", "A. Sharma", List.of())),
                "No adverse media on directors."),
            "Private limited company",
            new CompaniesHouse(customerId, null, "Active"),
            new SentimentAnalysis(40, new SentimentSummary(10, 25, 5, 40), "exports", customerId, "OK")
        );
    }
}
