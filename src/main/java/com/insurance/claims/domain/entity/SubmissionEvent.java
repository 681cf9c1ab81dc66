package com.insurance.claims.domain.entity;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

import com.insurance.claims.domain.valueobject.SubmissionEventType;
import com.insurance.claims.domain.valueobject.SubmissionState;

/**
 * Immutable event delivered to submission listeners.
 * <p>
 * Carries the attempt snapshot the event was raised for. Listeners read it;
 * nothing they do can change the attempt.
 * </p>
 */
public final class SubmissionEvent {

    private final String eventId;
    private final SubmissionEventType type;
    private final SubmissionAttempt attempt;
    private final Instant occurredAt;

    public SubmissionEvent(String eventId, SubmissionEventType type,
            SubmissionAttempt attempt, Instant occurredAt) {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("eventId cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (attempt == null) {
            throw new IllegalArgumentException("attempt cannot be null");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
        this.eventId = eventId;
        this.type = type;
        this.attempt = attempt;
        this.occurredAt = occurredAt;
    }

    // ─────────────────── Factory Methods ───────────────────

    public static SubmissionEvent of(SubmissionEventType type, SubmissionAttempt attempt) {
        return new SubmissionEvent(UUID.randomUUID().toString(), type, attempt, Instant.now());
    }

    public static SubmissionEvent stateChanged(SubmissionAttempt attempt) {
        return of(SubmissionEventType.STATE_CHANGED, attempt);
    }

    // ─────────────────── Accessors ───────────────────

    public String getEventId() {
        return eventId;
    }

    public SubmissionEventType getType() {
        return type;
    }

    public SubmissionAttempt getAttempt() {
        return attempt;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public String getAttemptId() {
        return attempt.getAttemptId();
    }

    public String getActorId() {
        return attempt.getActorId();
    }

    public String getClaimId() {
        return attempt.getClaimId();
    }

    public SubmissionState getState() {
        return attempt.getState();
    }

    // ─────────────────── Identity ───────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        SubmissionEvent that = (SubmissionEvent) o;
        return Objects.equals(eventId, that.eventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId);
    }

    @Override
    public String toString() {
        return "SubmissionEvent{eventId='" + eventId
                + "', type=" + type
                + ", attemptId='" + getAttemptId()
                + "', state=" + getState() + "}";
    }
}
