package com.kyb.core.listener;

import com.kyb.core.model.RunState;

/**
 * Observer of run state transitions, notified in transition order.
 * Implementations must return quickly; they run on the thread that made the transition.
 */
@FunctionalInterface
public interface RunStateListener {

    void onStateChanged(RunState previous, RunState current);
}
