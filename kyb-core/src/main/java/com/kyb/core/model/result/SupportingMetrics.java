package com.kyb.core.model.result;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SupportingMetrics(
    @JsonProperty("latest_period") String latestPeriod,
    @JsonProperty("high_risk_country_share_pct") int highRiskCountrySharePct,
    @JsonProperty("intl_outward_change_pct") int intlOutwardChangePct,
    @JsonProperty("cash_deposit_ratio_pct") int cashDepositRatioPct,
    @JsonProperty("period_covered_months") int periodCoveredMonths
) {}
