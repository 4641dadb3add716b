package com.kyb.core.model.result;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EntityProfile(
    @JsonProperty("customer_id") String customerId,
    @JsonProperty("legal_name") String legalName,
    @JsonProperty("sector") String sector,
    @JsonProperty("country_of_incorporation") String countryOfIncorporation,
    @JsonProperty("primary_operating_country") String primaryOperatingCountry,
    @JsonProperty("onboarding_date") String onboardingDate,
    @JsonProperty("kyb_status") String kybStatus,
    @JsonProperty("turnover_band_inr") String turnoverBandInr,
    @JsonProperty("kyb_last_review_date") String kybLastReviewDate,
    @JsonProperty("kyb_last_review_outcome") String kybLastReviewOutcome,
    @JsonProperty("journey_type") String journeyType
) {}
