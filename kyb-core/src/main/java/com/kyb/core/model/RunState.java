package com.kyb.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Value of the dashboard run state machine. Exactly one variant is current at any time.
 *
 * <pre>
 * Idle -> Running([]) -> Running([s1]) ... -> FetchingResult([s1..s6]) -> Completed | Failed
 * </pre>
 *
 * Invariants:
 * - completedSteps is always a prefix of {@link WorkflowStep#canonicalOrder()}
 * - FetchingResult always holds the full step sequence
 */
public sealed interface RunState
        permits RunState.Idle, RunState.Running, RunState.FetchingResult,
                RunState.Completed, RunState.Failed {

    RunPhase phase();

    /**
     * Steps finished so far. Empty for Idle and terminal states.
     */
    default List<WorkflowStep> completedSteps() {
        return List.of();
    }

    default boolean isTerminal() {
        return phase().isTerminal();
    }

    static RunState idle() {
        return Idle.INSTANCE;
    }

    static RunState running(List<WorkflowStep> completedSteps) {
        return new Running(completedSteps);
    }

    static RunState fetchingResult(List<WorkflowStep> completedSteps) {
        return new FetchingResult(completedSteps);
    }

    static RunState completed(String traceId, RiskBand riskBand) {
        return new Completed(traceId, riskBand);
    }

    static RunState failed(String message) {
        return new Failed(message);
    }

    /**
     * No run in progress.
     */
    final class Idle implements RunState {
        private static final Idle INSTANCE = new Idle();

        private Idle() {
        }

        @Override
        public RunPhase phase() {
            return RunPhase.IDLE;
        }

        @Override
        public String toString() {
            return "Idle";
        }
    }

    /**
     * A run is working through the simulated steps.
     */
    record Running(List<WorkflowStep> completedSteps) implements RunState {
        public Running {
            completedSteps = List.copyOf(completedSteps);
            if (!WorkflowStep.isCanonicalPrefix(completedSteps)
                    || completedSteps.size() == WorkflowStep.canonicalOrder().size()) {
                throw new IllegalArgumentException(
                    "Running steps must be a strict canonical prefix: " + completedSteps);
            }
        }

        @Override
        public RunPhase phase() {
            return RunPhase.RUNNING;
        }
    }

    /**
     * Every simulated step is done; the remote check is in flight.
     */
    record FetchingResult(List<WorkflowStep> completedSteps) implements RunState {
        public FetchingResult {
            completedSteps = List.copyOf(completedSteps);
            if (!completedSteps.equals(WorkflowStep.canonicalOrder())) {
                throw new IllegalArgumentException(
                    "FetchingResult requires every step completed: " + completedSteps);
            }
        }

        @Override
        public RunPhase phase() {
            return RunPhase.FETCHING_RESULT;
        }
    }

    /**
     * The remote check succeeded.
     */
    record Completed(String traceId, RiskBand riskBand) implements RunState {
        public Completed {
            Objects.requireNonNull(traceId, "traceId");
            Objects.requireNonNull(riskBand, "riskBand");
        }

        @Override
        public RunPhase phase() {
            return RunPhase.COMPLETED;
        }
    }

    /**
     * The run failed; message is shown in place of the progress view.
     */
    record Failed(String message) implements RunState {
        public Failed {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public RunPhase phase() {
            return RunPhase.FAILED;
        }
    }
}
