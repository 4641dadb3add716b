package com.kyb.core.exception;

import com.kyb.core.model.RunPhase;

/**
 * Thrown when a run attempts a transition the state machine does not allow.
 */
public class InvalidRunTransitionException extends KybException {
    
    public static final String ERROR_CODE = "INVALID_RUN_TRANSITION";
    
    public InvalidRunTransitionException(RunPhase currentPhase, RunPhase targetPhase) {
        super(ERROR_CODE, String.format(
            "Cannot transition run from %s to %s",
            currentPhase, targetPhase
        ));
    }
}
