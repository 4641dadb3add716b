package com.kyb.engine.coordinator;

import com.kyb.core.model.WorkflowStep;

import java.time.Duration;

/**
 * Pause before a simulated step is marked complete.
 */
@FunctionalInterface
public interface StepDelay {

    Duration DEFAULT_INTERVAL = Duration.ofSeconds(2);

    void await(WorkflowStep step) throws InterruptedException;

    static StepDelay fixed(Duration interval) {
        if (interval.isNegative()) {
            throw new IllegalArgumentException("Step delay must not be negative: " + interval);
        }
        long millis = interval.toMillis();
        return step -> {
            if (Thread.interrupted()) {
                throw new InterruptedException("Interrupted before step " + step);
            }
            if (millis > 0) {
                Thread.sleep(millis);
            }
        };
    }

    static StepDelay none() {
        return fixed(Duration.ZERO);
    }
}
