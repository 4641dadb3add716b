package com.kyb.engine.test;

import com.kyb.core.listener.RunStateListener;
import com.kyb.core.model.RunPhase;
import com.kyb.core.model.RunState;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Records every transition and lets tests wait for a phase.
 */
public class RunStateRecorder implements RunStateListener {

    private final List<RunState> states = new ArrayList<>();

    @Override
    public synchronized void onStateChanged(RunState previous, RunState current) {
        states.add(current);
        notifyAll();
    }

    public synchronized List<RunState> states() {
        return List.copyOf(states);
    }

    public synchronized void clear() {
        states.clear();
    }

    /**
     * Wait until a transition into the phase has been seen.
     */
    public synchronized RunState awaitPhase(RunPhase phase, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            for (RunState state : states) {
                if (state.phase() == phase) {
                    return state;
                }
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new AssertionError("Timed out waiting for " + phase + "; saw " + states);
            }
            wait(Math.max(1, remaining / 1_000_000));
        }
    }
}
