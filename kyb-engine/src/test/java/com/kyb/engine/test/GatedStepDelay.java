package com.kyb.engine.test;

import com.kyb.core.model.WorkflowStep;
import com.kyb.engine.coordinator.StepDelay;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Step delay that waits for the test to release each step.
 */
public class GatedStepDelay implements StepDelay {

    private final Semaphore permits = new Semaphore(0);
    private final CountDownLatch waiting = new CountDownLatch(1);
    private final CountDownLatch interrupted = new CountDownLatch(1);

    @Override
    public void await(WorkflowStep step) throws InterruptedException {
        waiting.countDown();
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            interrupted.countDown();
            throw e;
        }
    }

    public void release(int steps) {
        permits.release(steps);
    }

    public void releaseAll() {
        permits.release(WorkflowStep.canonicalOrder().size());
    }

    /**
     * Wait until the run thread is parked in the first step.
     */
    public boolean awaitWaiting(long timeout, TimeUnit unit) throws InterruptedException {
        return waiting.await(timeout, unit);
    }

    public boolean awaitInterrupted(long timeout, TimeUnit unit) throws InterruptedException {
        return interrupted.await(timeout, unit);
    }
}
