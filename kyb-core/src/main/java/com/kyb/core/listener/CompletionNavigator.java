package com.kyb.core.listener;

import com.kyb.core.model.NavigationTarget;

/**
 * Router that leaves the dashboard once a run completes.
 * Invoked exactly once per successful run.
 */
@FunctionalInterface
public interface CompletionNavigator {

    void onRunCompleted(NavigationTarget target);
}
