package com.kyb.core.repository;

import com.kyb.core.model.RiskDecision;

import java.util.Optional;

/**
 * Storage for relationship-manager decisions, keyed by trace id.
 */
public interface RiskDecisionRepository {

    void save(RiskDecision decision);

    Optional<RiskDecision> findByTraceId(String traceId);
}
