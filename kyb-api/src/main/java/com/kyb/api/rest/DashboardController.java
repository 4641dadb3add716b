package com.kyb.api.rest;

import com.kyb.core.exception.UnknownCustomerException;
import com.kyb.core.model.Customer;
import com.kyb.core.model.NavigationTarget;
import com.kyb.core.model.RecentCheckRecord;
import com.kyb.core.model.RiskBand;
import com.kyb.core.model.RunPhase;
import com.kyb.core.model.RunState;
import com.kyb.core.model.WorkflowStep;
import com.kyb.engine.service.DashboardService;
import com.kyb.engine.service.DashboardSnapshot;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * REST API for the dashboard screen and its run control.
 */
@RestController
@RequestMapping("/api/v1/dashboard")
public class DashboardController {

    private final DashboardService dashboardService;

    public DashboardController(DashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    /**
     * Enter the dashboard. Clears the current selection.
     */
    @GetMapping
    public ResponseEntity<DashboardResponse> enterDashboard() {
        return ResponseEntity.ok(DashboardResponse.from(dashboardService.enterDashboard()));
    }

    /**
     * Poll the dashboard without side effects.
     */
    @GetMapping("/state")
    public ResponseEntity<DashboardResponse> getState() {
        return ResponseEntity.ok(DashboardResponse.from(dashboardService.snapshot()));
    }

    @PostMapping("/customers/{customerId}/select")
    public ResponseEntity<DashboardResponse> selectCustomer(@PathVariable String customerId) {
        if (!dashboardService.selectCustomer(customerId)) {
            throw new UnknownCustomerException(customerId);
        }
        return ResponseEntity.ok(DashboardResponse.from(dashboardService.snapshot()));
    }

    /**
     * Start a run for the selected customer.
     * 202 when started; 409 when there is no selection or a run is not idle.
     */
    @PostMapping("/runs")
    public ResponseEntity<RunResponse> startRun() {
        boolean accepted = dashboardService.startRun();
        RunResponse response = new RunResponse(accepted, RunStateView.from(
            dashboardService.currentState(), dashboardService.currentTraceId().orElse(null)));
        return ResponseEntity.status(accepted ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT).body(response);
    }

    @PostMapping("/runs/reset")
    public ResponseEntity<DashboardResponse> resetRun() {
        dashboardService.resetRun();
        return ResponseEntity.ok(DashboardResponse.from(dashboardService.snapshot()));
    }

    /**
     * Take the navigation signal of a completed run and return the dashboard to idle.
     * 204 when there is nothing to navigate to.
     */
    @PostMapping("/navigation")
    public ResponseEntity<NavigationResponse> consumeNavigation() {
        Optional<NavigationTarget> target = dashboardService.consumeCompletionAndReset();
        if (target.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(NavigationResponse.from(target.get()));
    }

    @GetMapping("/recent-checks")
    public ResponseEntity<List<RecentCheckResponse>> recentChecks() {
        return ResponseEntity.ok(dashboardService.recentChecks().stream()
            .map(RecentCheckResponse::from)
            .toList());
    }

    // ========== DTOs ==========

    public record RunStateView(
        RunPhase phase,
        List<WorkflowStep> completedSteps,
        String traceId,
        RiskBand riskBand,
        String message
    ) {
        public static RunStateView from(RunState state, String traceId) {
            RiskBand band = null;
            String message = null;
            if (state instanceof RunState.Completed completed) {
                band = completed.riskBand();
            } else if (state instanceof RunState.Failed failed) {
                message = failed.message();
            }
            return new RunStateView(state.phase(), state.completedSteps(), traceId, band, message);
        }
    }

    public record RecentCheckResponse(
        String customerId,
        String customerName,
        RiskBand riskBand,
        Instant timestamp,
        String traceId
    ) {
        public static RecentCheckResponse from(RecentCheckRecord record) {
            return new RecentCheckResponse(
                record.customerId(),
                record.customerName(),
                record.riskBand(),
                record.timestamp(),
                record.traceId()
            );
        }
    }

    public record DashboardResponse(
        List<Customer> customers,
        String selectedCustomerId,
        List<RecentCheckResponse> recentChecks,
        RunStateView run,
        boolean firstTime,
        boolean runEnabled,
        boolean runControlHidden,
        String loadError
    ) {
        public static DashboardResponse from(DashboardSnapshot snapshot) {
            return new DashboardResponse(
                snapshot.availableCustomers(),
                snapshot.selectedCustomerId(),
                snapshot.recentChecks().stream().map(RecentCheckResponse::from).toList(),
                RunStateView.from(snapshot.runState(), snapshot.traceId()),
                snapshot.firstTime(),
                snapshot.runEnabled(),
                snapshot.runControlHidden(),
                snapshot.loadError()
            );
        }
    }

    public record RunResponse(boolean accepted, RunStateView run) {}

    public record NavigationResponse(
        String customerId,
        String traceId,
        RiskBand riskBand,
        String summaryPath
    ) {
        public static NavigationResponse from(NavigationTarget target) {
            return new NavigationResponse(
                target.customerId(),
                target.traceId(),
                target.riskBand(),
                "/api/v1/results/" + target.traceId() + "/summary"
            );
        }
    }
}
