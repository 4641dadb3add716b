package com.kyb.engine.metrics;

import com.kyb.core.model.RiskBand;
import com.kyb.core.model.RunPhase;
import com.kyb.core.model.WorkflowStep;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Micrometer metrics for dashboard runs.
 *
 * Metrics exposed:
 * - Runs started, completed (by risk band), failed, rejected and cancelled
 * - Step and remote-call latency
 * - Current run phase as a gauge per phase
 */
public class KybRunMetrics {

    public static final String RUNS_STARTED = "kyb.runs.started";
    public static final String RUNS_COMPLETED = "kyb.runs.completed";
    public static final String RUNS_FAILED = "kyb.runs.failed";
    public static final String RUNS_REJECTED = "kyb.runs.rejected";
    public static final String RUNS_CANCELLED = "kyb.runs.cancelled";
    public static final String RUN_DURATION = "kyb.run.duration";
    public static final String STEP_DURATION = "kyb.step.duration";
    public static final String REMOTE_DURATION = "kyb.remote.duration";
    public static final String RUN_PHASE = "kyb.run.phase";

    private final MeterRegistry registry;
    private final AtomicReference<RunPhase> currentPhase = new AtomicReference<>(RunPhase.IDLE);

    public KybRunMetrics() {
        this(new SimpleMeterRegistry());
    }

    public KybRunMetrics(MeterRegistry registry) {
        this.registry = registry;
        for (RunPhase phase : RunPhase.values()) {
            Gauge.builder(RUN_PHASE, currentPhase, current -> current.get() == phase ? 1 : 0)
                .tag("phase", phase.name())
                .description("1 when the dashboard run is in this phase")
                .register(registry);
        }
    }

    public MeterRegistry registry() {
        return registry;
    }

    public void phaseChanged(RunPhase phase) {
        currentPhase.set(phase);
    }

    public void runStarted() {
        Counter.builder(RUNS_STARTED)
            .description("Total KYB runs started")
            .register(registry)
            .increment();
    }

    public void runCompleted(RiskBand band, Duration duration) {
        Counter.builder(RUNS_COMPLETED)
            .tag("risk_band", band.name())
            .description("Total KYB runs completed successfully")
            .register(registry)
            .increment();

        Timer.builder(RUN_DURATION)
            .tag("outcome", "success")
            .description("KYB run duration from start to terminal state")
            .register(registry)
            .record(duration);
    }

    public void runFailed(String errorType, Duration duration) {
        Counter.builder(RUNS_FAILED)
            .tag("error_type", errorType)
            .description("Total KYB runs failed")
            .register(registry)
            .increment();

        Timer.builder(RUN_DURATION)
            .tag("outcome", "failure")
            .description("KYB run duration from start to terminal state")
            .register(registry)
            .record(duration);
    }

    public void runRejected(String reason) {
        Counter.builder(RUNS_REJECTED)
            .tag("reason", reason)
            .description("Start requests ignored")
            .register(registry)
            .increment();
    }

    public void runCancelled() {
        Counter.builder(RUNS_CANCELLED)
            .description("In-flight runs abandoned by reset or shutdown")
            .register(registry)
            .increment();
    }

    public void stepCompleted(WorkflowStep step, Duration duration) {
        Timer.builder(STEP_DURATION)
            .tag("step", step.name())
            .description("Simulated workflow step duration")
            .register(registry)
            .record(duration);
    }

    public void remoteCallCompleted(boolean success, Duration duration) {
        Timer.builder(REMOTE_DURATION)
            .tag("outcome", success ? "success" : "failure")
            .description("Remote KYB check latency")
            .register(registry)
            .record(duration);
    }
}
