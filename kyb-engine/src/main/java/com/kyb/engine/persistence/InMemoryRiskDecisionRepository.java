package com.kyb.engine.persistence;

import com.kyb.core.model.RiskDecision;
import com.kyb.core.repository.RiskDecisionRepository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of RiskDecisionRepository.
 */
public class InMemoryRiskDecisionRepository implements RiskDecisionRepository {

    private final Map<String, RiskDecision> decisions = new ConcurrentHashMap<>();

    @Override
    public void save(RiskDecision decision) {
        decisions.put(decision.traceId(), decision);
    }

    @Override
    public Optional<RiskDecision> findByTraceId(String traceId) {
        return Optional.ofNullable(decisions.get(traceId));
    }
}
