package com.kyb.core.model;

import com.kyb.core.model.result.KybRunResult;

import java.util.Objects;

/**
 * Result of the single remote check call. The gateway always resolves to one of these.
 */
public sealed interface CheckOutcome permits CheckOutcome.Success, CheckOutcome.Failure {

    String DEFAULT_FAILURE_MESSAGE = "Failed to load KYB data";

    static CheckOutcome success(KybRunResult result) {
        return new Success(result);
    }

    static CheckOutcome failure(String message) {
        return new Failure(message, null);
    }

    static CheckOutcome failure(String message, Throwable cause) {
        return new Failure(message, cause);
    }

    record Success(KybRunResult result) implements CheckOutcome {
        public Success {
            Objects.requireNonNull(result, "result");
        }
    }

    /**
     * Failure with a user-facing message. A blank message becomes the generic fallback.
     */
    record Failure(String message, Throwable cause) implements CheckOutcome {
        public Failure {
            if (message == null || message.isBlank()) {
                message = cause != null && cause.getMessage() != null && !cause.getMessage().isBlank()
                    ? cause.getMessage()
                    : DEFAULT_FAILURE_MESSAGE;
            }
        }
    }
}
