package com.kyb.engine.service;

import com.kyb.core.model.RiskBand;
import com.kyb.core.model.result.CompaniesHouse;
import com.kyb.core.model.result.EntityProfile;
import com.kyb.core.model.result.Party;
import com.kyb.core.model.result.SentimentSummary;

import java.util.List;

/**
 * Summary tab of the customer detail view.
 */
public record CustomerSummaryView(
    String traceId,
    String customerId,
    EntityProfile entityProfile,
    int score,
    RiskBand riskBand,
    String overallReasoning,
    String kybNote,
    String transactionSummary,
    List<Party> parties,
    String keyObservations,
    CompaniesHouse companiesHouse,
    SentimentSummary sentiment
) {
    public CustomerSummaryView {
        parties = parties == null ? List.of() : List.copyOf(parties);
    }
}
