package com.insurance.claims.application.port.out;

import com.insurance.claims.domain.entity.SubmissionEvent;

/**
 * Secondary (outbound) port: consumer of submission state transitions and
 * presentation events.
 * <p>
 * Events arrive in transition order, after the state they describe has been
 * applied. Listeners observe only; a listener failure is logged and never
 * affects the attempt.
 * </p>
 */
public interface SubmissionEventListener {

    /**
     * @param event immutable event with the attempt snapshot
     */
    void onEvent(SubmissionEvent event);
}
