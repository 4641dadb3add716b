package com.kyb.engine.service;

import com.kyb.core.model.Customer;
import com.kyb.core.model.RecentCheckRecord;
import com.kyb.core.model.RunPhase;
import com.kyb.core.model.RunState;

import java.util.List;

/**
 * Everything the dashboard screen renders, taken at one point in time.
 *
 * @param loadError message when the customer directory or history could not be loaded
 */
public record DashboardSnapshot(
    List<Customer> availableCustomers,
    String selectedCustomerId,
    List<RecentCheckRecord> recentChecks,
    RunState runState,
    String traceId,
    String loadError
) {
    public DashboardSnapshot {
        availableCustomers = availableCustomers == null ? List.of() : List.copyOf(availableCustomers);
        recentChecks = recentChecks == null ? List.of() : List.copyOf(recentChecks);
    }

    /**
     * No check has ever completed.
     */
    public boolean firstTime() {
        return recentChecks.isEmpty();
    }

    public boolean runEnabled() {
        return selectedCustomerId != null && runState.phase() == RunPhase.IDLE;
    }

    /**
     * The run control gives way to the progress view once a run has started.
     */
    public boolean runControlHidden() {
        return runState.phase() != RunPhase.IDLE;
    }
}
