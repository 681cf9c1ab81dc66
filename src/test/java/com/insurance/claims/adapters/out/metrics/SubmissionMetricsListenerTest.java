package com.insurance.claims.adapters.out.metrics;

import java.math.BigDecimal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.insurance.claims.domain.entity.ApprovalResult;
import com.insurance.claims.domain.entity.SubmissionAttempt;
import com.insurance.claims.domain.entity.SubmissionEvent;
import com.insurance.claims.domain.valueobject.SubmissionEventType;
import com.insurance.claims.domain.valueobject.SubmissionState;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SubmissionMetricsListener Unit Tests")
class SubmissionMetricsListenerTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final SubmissionMetricsListener listener = new SubmissionMetricsListener(meterRegistry);

    private SubmissionAttempt approved() {
        return SubmissionAttempt.start("actor-1", "C-1")
                .transitionTo(SubmissionState.VALIDATING)
                .transitionTo(SubmissionState.UPLOADING_MEDIA)
                .transitionTo(SubmissionState.SUBMITTING)
                .approve(new ApprovalResult(new BigDecimal("100.00"), 12));
    }

    @Test
    @DisplayName("Should count terminal outcomes once and time them")
    void shouldRecordTerminalOutcome() {
        SubmissionAttempt attempt = approved();

        listener.onEvent(SubmissionEvent.stateChanged(attempt));
        listener.onEvent(SubmissionEvent.of(SubmissionEventType.CELEBRATE, attempt));

        assertThat(meterRegistry.counter("claims.submission.outcome",
                "state", "APPROVED", "failure_stage", "none").count()).isEqualTo(1.0);
        assertThat(meterRegistry.timer("claims.submission.latency", "state", "APPROVED").count()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Should ignore in-flight transitions")
    void shouldIgnoreInFlightStates() {
        listener.onEvent(SubmissionEvent.stateChanged(
                SubmissionAttempt.start("actor-1", "C-1").transitionTo(SubmissionState.VALIDATING)));

        assertThat(meterRegistry.find("claims.submission.outcome").counter()).isNull();
    }
}
