package com.kyb.engine.metrics;

import com.kyb.core.model.RiskBand;
import com.kyb.core.model.RunPhase;
import com.kyb.core.model.WorkflowStep;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class KybRunMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final KybRunMetrics metrics = new KybRunMetrics(registry);

    @Test
    void countsCompletedRunsByBand() {
        metrics.runStarted();
        metrics.runCompleted(RiskBand.RED, Duration.ofSeconds(13));
        metrics.runCompleted(RiskBand.RED, Duration.ofSeconds(12));

        assertThat(registry.get(KybRunMetrics.RUNS_STARTED).counter().count()).isEqualTo(1.0);
        assertThat(registry.get(KybRunMetrics.RUNS_COMPLETED).tag("risk_band", "RED").counter().count())
            .isEqualTo(2.0);
        assertThat(registry.get(KybRunMetrics.RUN_DURATION).tag("outcome", "success").timer().count())
            .isEqualTo(2);
    }

    @Test
    void recordsFailuresAndStepLatency() {
        metrics.runFailed("fetch", Duration.ofSeconds(1));
        metrics.stepCompleted(WorkflowStep.RISK_RULES, Duration.ofMillis(2000));
        metrics.remoteCallCompleted(false, Duration.ofMillis(300));

        assertThat(registry.get(KybRunMetrics.RUNS_FAILED).tag("error_type", "fetch").counter().count())
            .isEqualTo(1.0);
        assertThat(registry.get(KybRunMetrics.STEP_DURATION).tag("step", "RISK_RULES").timer().count())
            .isEqualTo(1);
        assertThat(registry.get(KybRunMetrics.REMOTE_DURATION).tag("outcome", "failure").timer().count())
            .isEqualTo(1);
    }

    @Test
    void phaseGaugeTracksCurrentPhase() {
        metrics.phaseChanged(RunPhase.FETCHING_RESULT);

        assertThat(registry.get(KybRunMetrics.RUN_PHASE).tag("phase", "FETCHING_RESULT").gauge().value())
            .isEqualTo(1.0);
        assertThat(registry.get(KybRunMetrics.RUN_PHASE).tag("phase", "IDLE").gauge().value())
            .isEqualTo(0.0);
    }
}
