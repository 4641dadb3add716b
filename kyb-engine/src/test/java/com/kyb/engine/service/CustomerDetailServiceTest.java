package com.kyb.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kyb.core.exception.ResultNotFoundException;
import com.kyb.core.json.KybJson;
import com.kyb.core.model.CachedResult;
import com.kyb.core.model.RiskBand;
import com.kyb.core.model.RiskDecision;
import com.kyb.core.model.result.TriggerFired;
import com.kyb.core.telemetry.EventNames;
import com.kyb.engine.persistence.InMemoryResultCacheRepository;
import com.kyb.engine.persistence.InMemoryRiskDecisionRepository;
import com.kyb.engine.test.KybFixtures;
import com.kyb.engine.test.RecordingEventEmitter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

class CustomerDetailServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-15T11:00:00Z");

    private final ObjectMapper objectMapper = KybJson.newObjectMapper();
    private InMemoryResultCacheRepository cache;
    private RecordingEventEmitter events;
    private CustomerDetailService service;

    @BeforeEach
    void setUp() {
        cache = new InMemoryResultCacheRepository();
        events = new RecordingEventEmitter();
        service = new CustomerDetailService(cache, new InMemoryRiskDecisionRepository(), events,
            objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
        cache.store(new CachedResult("trace-1", "CUST-0001",
            KybFixtures.result("CUST-0001", RiskBand.AMBER), Instant.parse("2025-01-15T10:30:00Z")));
    }

    @Test
    @DisplayName("Summary is built from the cached payload")
    void summaryFromCache() {
        CustomerSummaryView summary = service.summary("trace-1");

        assertThat(summary.customerId()).isEqualTo("CUST-0001");
        assertThat(summary.riskBand()).isEqualTo(RiskBand.AMBER);
        assertThat(summary.score()).isEqualTo(62);
        assertThat(summary.entityProfile().legalName()).isEqualTo(KybFixtures.LEGAL_NAME);
        assertThat(summary.parties()).hasSize(1);
        assertThat(summary.sentiment().total()).isEqualTo(40);
        assertThat(events.named(EventNames.CUSTOMER_DETAIL_LOADED)).hasSize(1);
    }

    @Test
    @DisplayName("Risk tab lists fired triggers and recommended actions")
    void riskActionsFromCache() {
        RiskActionsView risk = service.riskActions("trace-1");

        assertThat(risk.triggersFired()).extracting(TriggerFired::code).containsExactly("INTL_OUTWARD_SPIKE");
        assertThat(risk.scoreBreakdown().baseScore()).isEqualTo(42);
        assertThat(risk.scoreBreakdown().totalDelta()).isEqualTo(20);
        assertThat(risk.recommendedActions()).hasSize(2);
    }

    @Test
    @DisplayName("Unknown trace id is not found")
    void unknownTraceIsNotFound() {
        assertThatThrownBy(() -> service.summary("trace-unknown"))
            .isInstanceOf(ResultNotFoundException.class)
            .hasMessageContaining("trace-unknown");
        assertThatThrownBy(() -> service.auditJson(null))
            .isInstanceOf(ResultNotFoundException.class);
    }

    @Test
    @DisplayName("Decision defaults to the model band until an override is recorded")
    void decisionOverride() {
        RiskDecision initial = service.findDecision("trace-1");
        assertThat(initial.effectiveBand()).isEqualTo(RiskBand.AMBER);
        assertThat(initial.isOverridden()).isFalse();

        RiskDecision recorded = service.recordDecision("trace-1", RiskBand.RED, "Adverse media found");

        assertThat(recorded.updatedAt()).isEqualTo(NOW);
        assertThat(service.findDecision("trace-1")).isEqualTo(recorded);
        assertThat(recorded.effectiveBand()).isEqualTo(RiskBand.RED);
        assertThat(recorded.isOverridden()).isTrue();
        assertThat(events.named(EventNames.RM_OVERRIDE_UPDATED).get(0).fields())
            .containsEntry("override", "RED")
            .containsEntry("screen", "Decision");
    }

    @Test
    @DisplayName("Audit JSON keeps the wire field names")
    void auditJsonUsesWireNames() throws Exception {
        String json = service.auditJson("trace-1");

        JsonNode tree = objectMapper.readTree(json);
        assertThat(tree.path("risk_assessment").path("risk_band").asText()).isEqualTo("AMBER");
        assertThat(tree.path("_audit_trail").path("agents_called").size()).isEqualTo(3);
        assertThat(json).contains("\n");
    }
}
