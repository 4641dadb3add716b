package com.kyb.core.model;

/**
 * Where the dashboard routes after a completed run: the customer detail view for this trace.
 */
public record NavigationTarget(String customerId, String traceId, RiskBand riskBand) {}
