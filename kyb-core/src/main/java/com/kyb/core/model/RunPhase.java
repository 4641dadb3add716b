package com.kyb.core.model;

/**
 * Lifecycle phases of a dashboard check run.
 * Transitions follow a strict state machine; only resetRun() returns to IDLE.
 */
public enum RunPhase {
    /**
     * No run in progress, no trace id held.
     * Transitions: -> RUNNING, FAILED
     */
    IDLE,

    /**
     * Simulated steps are being worked through.
     * Transitions: -> RUNNING (next step), FETCHING_RESULT, FAILED
     */
    RUNNING,

    /**
     * All simulated steps done, remote call in flight.
     * Transitions: -> COMPLETED, FAILED
     */
    FETCHING_RESULT,

    /**
     * Remote call succeeded. Terminal state.
     */
    COMPLETED,

    /**
     * Remote call or run failed. Terminal state.
     */
    FAILED;

    /**
     * Check if this phase is terminal (only a reset leaves it).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Check if a run is currently in flight.
     */
    public boolean isInFlight() {
        return this == RUNNING || this == FETCHING_RESULT;
    }

    /**
     * Check if this phase can move to the target phase during a run.
     * A reset to IDLE is always allowed and is not modelled here.
     */
    public boolean canTransitionTo(RunPhase target) {
        return switch (this) {
            case IDLE -> target == RUNNING || target == FAILED;
            case RUNNING -> target == RUNNING || target == FETCHING_RESULT || target == FAILED;
            case FETCHING_RESULT -> target == COMPLETED || target == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
