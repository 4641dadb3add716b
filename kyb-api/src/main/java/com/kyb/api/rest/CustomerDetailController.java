package com.kyb.api.rest;

import com.kyb.core.model.RiskBand;
import com.kyb.core.model.RiskDecision;
import com.kyb.engine.service.CustomerDetailService;
import com.kyb.engine.service.CustomerSummaryView;
import com.kyb.engine.service.RiskActionsView;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Locale;

/**
 * REST API for the customer detail tabs of a completed run.
 */
@RestController
@RequestMapping("/api/v1/results/{traceId}")
public class CustomerDetailController {

    private final CustomerDetailService detailService;

    public CustomerDetailController(CustomerDetailService detailService) {
        this.detailService = detailService;
    }

    @GetMapping("/summary")
    public ResponseEntity<CustomerSummaryView> summary(@PathVariable String traceId) {
        return ResponseEntity.ok(detailService.summary(traceId));
    }

    @GetMapping("/risk")
    public ResponseEntity<RiskActionsView> riskActions(@PathVariable String traceId) {
        return ResponseEntity.ok(detailService.riskActions(traceId));
    }

    @GetMapping("/decision")
    public ResponseEntity<DecisionResponse> getDecision(@PathVariable String traceId) {
        return ResponseEntity.ok(DecisionResponse.from(detailService.findDecision(traceId)));
    }

    /**
     * Record the relationship manager's override. An empty band keeps the model band.
     */
    @PutMapping("/decision")
    public ResponseEntity<DecisionResponse> updateDecision(
            @PathVariable String traceId,
            @RequestBody DecisionRequest request) {
        RiskDecision decision = detailService.recordDecision(
            traceId, request.parsedOverrideBand(), request.comments());
        return ResponseEntity.ok(DecisionResponse.from(decision));
    }

    /**
     * Raw payload as received from the KYB service.
     */
    @GetMapping("/audit")
    public ResponseEntity<String> audit(@PathVariable String traceId) {
        return ResponseEntity.ok()
            .contentType(MediaType.APPLICATION_JSON)
            .body(detailService.auditJson(traceId));
    }

    // ========== DTOs ==========

    public record DecisionRequest(String overrideBand, String comments) {

        RiskBand parsedOverrideBand() {
            if (overrideBand == null || overrideBand.isBlank()) {
                return null;
            }
            try {
                return RiskBand.valueOf(overrideBand.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown risk band: " + overrideBand, e);
            }
        }
    }

    public record DecisionResponse(
        String traceId,
        String customerId,
        RiskBand modelBand,
        RiskBand overrideBand,
        RiskBand effectiveBand,
        boolean overridden,
        String comments,
        Instant updatedAt
    ) {
        public static DecisionResponse from(RiskDecision decision) {
            return new DecisionResponse(
                decision.traceId(),
                decision.customerId(),
                decision.modelBand(),
                decision.overrideBand(),
                decision.effectiveBand(),
                decision.isOverridden(),
                decision.comments(),
                decision.updatedAt()
            );
        }
    }
}
