package com.kyb.engine.service;

import com.kyb.core.listener.RunStateListener;
import com.kyb.core.model.NavigationTarget;
import com.kyb.core.model.RecentCheckRecord;
import com.kyb.core.model.RunState;

import java.util.List;
import java.util.Optional;

/**
 * Dashboard operations: customer selection, the KYB run state machine and
 * the one-shot hand-off to the customer detail view.
 *
 * No operation throws because of a run failure; failures surface as
 * {@link RunState.Failed}.
 */
public interface DashboardService {

    /**
     * (Re)enter the dashboard. Clears the selection and loads the customer
     * directory and recent checks.
     */
    DashboardSnapshot enterDashboard();

    /**
     * Current dashboard view without side effects.
     */
    DashboardSnapshot snapshot();

    /**
     * Select the customer the next run is for. Allowed while a run is in progress.
     *
     * @return false if the id is blank or not in the directory
     */
    boolean selectCustomer(String customerId);

    Optional<String> selectedCustomerId();

    /**
     * Start a KYB run for the selected customer.
     *
     * @return true if a run was started, false if there is no selection
     *         or the state is not idle
     */
    boolean startRun();

    /**
     * Abandon any in-flight run and return to idle. Always legal.
     */
    void resetRun();

    /**
     * Abandon any in-flight run without changing the state (scope tear-down).
     */
    void cancelRun();

    RunState currentState();

    /**
     * Trace id of the current run, empty when idle.
     */
    Optional<String> currentTraceId();

    /**
     * Hand out the navigation target of a completed run, at most once per run.
     */
    Optional<NavigationTarget> consumeCompletionForNavigation();

    /**
     * Hand out the navigation target and return to idle in one step.
     * Nothing is reset when there is no completion to hand out.
     */
    Optional<NavigationTarget> consumeCompletionAndReset();

    List<RecentCheckRecord> recentChecks();

    /**
     * Customer the last run was started for, as persisted across restarts.
     */
    Optional<String> lastRunCustomerId();

    void addListener(RunStateListener listener);

    void removeListener(RunStateListener listener);
}
