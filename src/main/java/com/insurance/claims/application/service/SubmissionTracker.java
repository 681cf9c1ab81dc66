package com.insurance.claims.application.service;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.insurance.claims.domain.entity.SubmissionAttempt;
import com.insurance.claims.domain.entity.SubmissionEvent;
import com.insurance.claims.domain.valueobject.SubmissionEventType;
import com.insurance.claims.domain.valueobject.SubmissionState;

/**
 * Single writer of one attempt's state.
 * <p>
 * Every transition is compare-and-set against the state the caller expects,
 * so a stage completion can apply at most once and never after the attempt
 * has moved on. The STATE_CHANGED event is published only after the new
 * snapshot is visible through {@link #current()}.
 * </p>
 */
class SubmissionTracker {

    private static final Logger log = LoggerFactory.getLogger(SubmissionTracker.class);

    private final AtomicReference<SubmissionAttempt> attempt;
    private final SubmissionEventBus eventBus;

    SubmissionTracker(SubmissionAttempt initial, SubmissionEventBus eventBus) {
        this.attempt = new AtomicReference<>(initial);
        this.eventBus = eventBus;
    }

    SubmissionAttempt current() {
        return attempt.get();
    }

    String attemptId() {
        return attempt.get().getAttemptId();
    }

    /**
     * Applies a transition if the attempt is still in the expected state.
     *
     * @param expected   state the transition starts from
     * @param transition produces the next snapshot from the current one
     * @return true if applied; false if the attempt is no longer in {@code expected}
     */
    boolean advance(SubmissionState expected, UnaryOperator<SubmissionAttempt> transition) {
        while (true) {
            SubmissionAttempt current = attempt.get();
            if (current.getState() != expected) {
                log.warn("action=stale_transition_ignored attemptId={} expected={} actual={}",
                        current.getAttemptId(), expected, current.getState());
                return false;
            }
            SubmissionAttempt next = transition.apply(current);
            if (attempt.compareAndSet(current, next)) {
                log.info("action=state_transition attemptId={} actorId={} from={} to={}",
                        next.getAttemptId(), next.getActorId(), current.getState(), next.getState());
                eventBus.publish(SubmissionEvent.stateChanged(next));
                return true;
            }
        }
    }

    /**
     * Publishes a presentation event for the current snapshot.
     */
    void publish(SubmissionEventType type) {
        eventBus.publish(SubmissionEvent.of(type, attempt.get()));
    }
}
