package com.insurance.claims.adapters.out.metrics;

import java.time.Duration;

import org.springframework.stereotype.Component;

import com.insurance.claims.application.port.out.SubmissionEventListener;
import com.insurance.claims.domain.entity.SubmissionAttempt;
import com.insurance.claims.domain.entity.SubmissionEvent;
import com.insurance.claims.domain.valueobject.SubmissionEventType;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Records terminal outcomes and end-to-end latency of submission attempts.
 */
@Component
public class SubmissionMetricsListener implements SubmissionEventListener {

    private final MeterRegistry meterRegistry;

    public SubmissionMetricsListener(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void onEvent(SubmissionEvent event) {
        if (event.getType() != SubmissionEventType.STATE_CHANGED || !event.getState().isTerminal()) {
            return;
        }
        SubmissionAttempt attempt = event.getAttempt();
        String stage = attempt.getFailure().map(failure -> failure.stage().name()).orElse("none");

        meterRegistry.counter("claims.submission.outcome",
                "state", attempt.getState().name(),
                "failure_stage", stage).increment();
        meterRegistry.timer("claims.submission.latency", "state", attempt.getState().name())
                .record(Duration.between(attempt.getStartedAt(), attempt.getUpdatedAt()));
    }
}
