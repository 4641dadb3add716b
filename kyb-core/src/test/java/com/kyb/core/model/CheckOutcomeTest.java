package com.kyb.core.model;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

class CheckOutcomeTest {

    @Test
    void failure_shouldKeepExplicitMessage() {
        CheckOutcome.Failure failure = (CheckOutcome.Failure) CheckOutcome.failure("HTTP 503");
        assertThat(failure.message()).isEqualTo("HTTP 503");
    }

    @Test
    void failure_shouldFallBackToCauseMessage() {
        CheckOutcome.Failure failure =
            (CheckOutcome.Failure) CheckOutcome.failure(null, new IOException("connection reset"));
        assertThat(failure.message()).isEqualTo("connection reset");
    }

    @Test
    void failure_shouldFallBackToGenericMessage() {
        CheckOutcome.Failure failure =
            (CheckOutcome.Failure) CheckOutcome.failure("  ", new IllegalStateException());
        assertThat(failure.message()).isEqualTo(CheckOutcome.DEFAULT_FAILURE_MESSAGE);
    }
}
