package com.kyb.engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kyb.core.exception.KybException;
import com.kyb.core.exception.ResultNotFoundException;
import com.kyb.core.model.CachedResult;
import com.kyb.core.model.RiskBand;
import com.kyb.core.model.RiskDecision;
import com.kyb.core.model.result.KybRunResult;
import com.kyb.core.model.result.PartySummary;
import com.kyb.core.model.result.RiskAssessment;
import com.kyb.core.model.result.SentimentAnalysis;
import com.kyb.core.model.result.TransactionInsights;
import com.kyb.core.repository.ResultCacheRepository;
import com.kyb.core.repository.RiskDecisionRepository;
import com.kyb.core.telemetry.EventEmitter;
import com.kyb.core.telemetry.EventNames;
import com.kyb.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read side of a completed run. Every view is built from the cached payload
 * of the given trace; nothing is fetched again.
 */
public class CustomerDetailService {

    private static final Logger log = LoggerFactory.getLogger(CustomerDetailService.class);

    public static final String AUDIT_RENDER_FAILED = "AUDIT_RENDER_FAILED";

    private final ResultCacheRepository resultCacheRepository;
    private final RiskDecisionRepository decisionRepository;
    private final EventEmitter eventEmitter;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CustomerDetailService(
            ResultCacheRepository resultCacheRepository,
            RiskDecisionRepository decisionRepository,
            EventEmitter eventEmitter,
            ObjectMapper objectMapper,
            Clock clock) {
        this.resultCacheRepository = resultCacheRepository;
        this.decisionRepository = decisionRepository;
        this.eventEmitter = eventEmitter;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public CustomerSummaryView summary(String traceId) {
        CachedResult cached = requireCached(traceId);
        KybRunResult result = cached.result();
        RiskAssessment assessment = result.riskAssessment();
        TransactionInsights insights = result.transactionInsights();
        PartySummary partySummary = result.partySummary();
        SentimentAnalysis sentiment = result.sentimentAnalysis();

        emit(EventNames.CUSTOMER_DETAIL_LOADED, cached, "Summary", null);

        return new CustomerSummaryView(
            cached.traceId(),
            cached.customerId(),
            result.entityProfile(),
            assessment != null ? assessment.score() : 0,
            result.riskBand(),
            assessment != null ? assessment.overallReasoning() : null,
            result.kybNote(),
            insights != null ? insights.summary() : null,
            partySummary != null ? partySummary.parties() : null,
            partySummary != null ? partySummary.keyObservations() : null,
            result.companiesHouse(),
            sentiment != null ? sentiment.sentimentSummary() : null
        );
    }

    public RiskActionsView riskActions(String traceId) {
        CachedResult cached = requireCached(traceId);
        KybRunResult result = cached.result();
        RiskAssessment assessment = result.riskAssessment();
        TransactionInsights insights = result.transactionInsights();

        return new RiskActionsView(
            cached.traceId(),
            result.riskBand(),
            assessment != null ? assessment.score() : 0,
            assessment != null ? assessment.triggersFired() : null,
            assessment != null ? assessment.scoreBreakdown() : null,
            insights != null ? insights.candidateTriggers() : null,
            insights != null ? insights.supportingMetrics() : null,
            result.recommendedActions()
        );
    }

    /**
     * Record the relationship manager's decision. A null override keeps the model band.
     */
    public RiskDecision recordDecision(String traceId, RiskBand overrideBand, String comments) {
        CachedResult cached = requireCached(traceId);
        RiskDecision decision = new RiskDecision(
            cached.traceId(),
            cached.customerId(),
            cached.result().riskBand(),
            overrideBand,
            comments,
            clock.instant()
        );
        decisionRepository.save(decision);

        try (LoggingContext ignored = LoggingContext.forRun(cached.traceId(), cached.customerId(), "Decision")) {
            log.info("Decision recorded: model={} override={}", decision.modelBand(), overrideBand);
        }
        emit(EventNames.RM_OVERRIDE_UPDATED, cached, "Decision",
            overrideBand != null ? overrideBand.name() : null);
        return decision;
    }

    /**
     * Current decision for the trace; the model band with no override until one is recorded.
     */
    public RiskDecision findDecision(String traceId) {
        CachedResult cached = requireCached(traceId);
        return decisionRepository.findByTraceId(cached.traceId())
            .orElseGet(() -> new RiskDecision(
                cached.traceId(), cached.customerId(), cached.result().riskBand(), null, "", cached.cachedAt()));
    }

    /**
     * The cached payload as indented JSON, field names as received.
     */
    public String auditJson(String traceId) {
        CachedResult cached = requireCached(traceId);
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(cached.result());
        } catch (JsonProcessingException e) {
            throw new KybException(AUDIT_RENDER_FAILED, "Failed to render audit JSON: " + e.getMessage(), e);
        }
    }

    private CachedResult requireCached(String traceId) {
        return resultCacheRepository.findByTraceId(traceId)
            .orElseThrow(() -> new ResultNotFoundException(traceId));
    }

    private void emit(String eventName, CachedResult cached, String screen, String override) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("traceId", cached.traceId());
        fields.put("customerId", cached.customerId());
        fields.put("screen", screen);
        if (override != null) {
            fields.put("override", override);
        }
        try {
            eventEmitter.emitEvent(eventName, fields);
        } catch (RuntimeException e) {
            log.warn("Telemetry event {} failed: {}", eventName, e.getMessage());
        }
    }
}
