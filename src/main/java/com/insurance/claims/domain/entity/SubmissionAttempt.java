package com.insurance.claims.domain.entity;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.insurance.claims.domain.valueobject.SubmissionState;

/**
 * State machine entity for one claim submission attempt.
 * <p>
 * <b>IMMUTABLE:</b> every transition returns a NEW instance, so a snapshot
 * handed to a listener can never change under it.
 * </p>
 *
 * <pre>
 * State Machine:
 *   IDLE ──[submit]──→ VALIDATING
 *   VALIDATING ──[gate passed]──→ UPLOADING_MEDIA
 *   UPLOADING_MEDIA ──[evidence ready]──→ SUBMITTING
 *   SUBMITTING ──[instant_approved]──→ APPROVED
 *   SUBMITTING ──[under_review]──→ UNDER_REVIEW
 *   SUBMITTING ──[rejected | flagged]──→ REJECTED
 *   VALIDATING | UPLOADING_MEDIA | SUBMITTING ──[stage error]──→ FAILED
 * </pre>
 */
public final class SubmissionAttempt {

    private static final Map<SubmissionState, Set<SubmissionState>> VALID_TRANSITIONS;

    static {
        Map<SubmissionState, Set<SubmissionState>> transitions = new EnumMap<>(SubmissionState.class);
        transitions.put(SubmissionState.IDLE, EnumSet.of(SubmissionState.VALIDATING));
        transitions.put(SubmissionState.VALIDATING,
                EnumSet.of(SubmissionState.UPLOADING_MEDIA, SubmissionState.FAILED));
        transitions.put(SubmissionState.UPLOADING_MEDIA,
                EnumSet.of(SubmissionState.SUBMITTING, SubmissionState.FAILED));
        transitions.put(SubmissionState.SUBMITTING, EnumSet.of(
                SubmissionState.APPROVED, SubmissionState.UNDER_REVIEW,
                SubmissionState.REJECTED, SubmissionState.FAILED));
        // Terminal states have no valid transitions
        transitions.put(SubmissionState.APPROVED, Collections.emptySet());
        transitions.put(SubmissionState.UNDER_REVIEW, Collections.emptySet());
        transitions.put(SubmissionState.REJECTED, Collections.emptySet());
        transitions.put(SubmissionState.FAILED, Collections.emptySet());
        VALID_TRANSITIONS = Collections.unmodifiableMap(transitions);
    }

    private final String attemptId;
    private final String actorId;
    private final String claimId;
    private final SubmissionState state;
    private final ApprovalResult approvalResult;
    private final String message;
    private final SubmissionFailure failure;
    private final Instant startedAt;
    private final Instant updatedAt;

    // ─────────────────── Private Constructor ───────────────────

    private SubmissionAttempt(String attemptId, String actorId, String claimId,
            SubmissionState state, ApprovalResult approvalResult, String message,
            SubmissionFailure failure, Instant startedAt, Instant updatedAt) {
        if (attemptId == null || attemptId.isBlank()) {
            throw new IllegalArgumentException("attemptId cannot be null or blank");
        }
        if (actorId == null || actorId.isBlank()) {
            throw new IllegalArgumentException("actorId cannot be null or blank");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt cannot be null");
        }

        this.attemptId = attemptId;
        this.actorId = actorId;
        this.claimId = claimId;
        this.state = state;
        this.approvalResult = approvalResult;
        this.message = message;
        this.failure = failure;
        this.startedAt = startedAt;
        this.updatedAt = updatedAt != null ? updatedAt : Instant.now();
    }

    // ─────────────────── Factory Methods ───────────────────

    /**
     * Creates a fresh attempt in IDLE for the given actor and claim.
     *
     * @param actorId submitter owning the attempt
     * @param claimId claim being submitted
     * @return new attempt with a generated attemptId
     */
    public static SubmissionAttempt start(String actorId, String claimId) {
        Instant now = Instant.now();
        return new SubmissionAttempt(UUID.randomUUID().toString(), actorId, claimId,
                SubmissionState.IDLE, null, null, null, now, now);
    }

    // ─────────────────── State Transitions ───────────────────

    /**
     * Moves to a state that carries no payload: VALIDATING, UPLOADING_MEDIA,
     * SUBMITTING or UNDER_REVIEW.
     *
     * @param newState target state
     * @return a NEW attempt in the target state
     * @throws IllegalStateException    if the transition is not allowed from the current state
     * @throws IllegalArgumentException if the target state needs a payload
     */
    public SubmissionAttempt transitionTo(SubmissionState newState) {
        if (newState == SubmissionState.APPROVED || newState == SubmissionState.REJECTED
                || newState == SubmissionState.FAILED) {
            throw new IllegalArgumentException(newState + " requires a payload; use approve/reject/fail");
        }
        return next(newState, null, null, null);
    }

    /**
     * SUBMITTING → APPROVED with payout terms.
     */
    public SubmissionAttempt approve(ApprovalResult result) {
        if (result == null) {
            throw new IllegalArgumentException("approval result cannot be null");
        }
        return next(SubmissionState.APPROVED, result, null, null);
    }

    /**
     * SUBMITTING → REJECTED carrying the Decision Service's next-step guidance.
     */
    public SubmissionAttempt reject(String nextSteps) {
        return next(SubmissionState.REJECTED, null, nextSteps, null);
    }

    /**
     * Any in-flight state → FAILED.
     */
    public SubmissionAttempt fail(SubmissionFailure submissionFailure) {
        if (submissionFailure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        return next(SubmissionState.FAILED, null, submissionFailure.message(), submissionFailure);
    }

    private SubmissionAttempt next(SubmissionState newState, ApprovalResult result,
            String newMessage, SubmissionFailure newFailure) {
        if (!isValidTransition(this.state, newState)) {
            throw new IllegalStateException(
                    "Invalid transition: " + this.state + " → " + newState
                            + " for attempt " + this.attemptId);
        }
        return new SubmissionAttempt(attemptId, actorId, claimId, newState, result,
                newMessage, newFailure, startedAt, Instant.now());
    }

    /**
     * Checks a transition against the state machine table.
     */
    public static boolean isValidTransition(SubmissionState from, SubmissionState to) {
        Set<SubmissionState> allowed = VALID_TRANSITIONS.get(from);
        return allowed != null && allowed.contains(to);
    }

    // ─────────────────── Query Methods ───────────────────

    public boolean isComplete() {
        return state.isTerminal();
    }

    public boolean isFailed() {
        return state == SubmissionState.FAILED;
    }

    // ─────────────────── Getters ───────────────────

    public String getAttemptId() {
        return attemptId;
    }

    public String getActorId() {
        return actorId;
    }

    public String getClaimId() {
        return claimId;
    }

    public SubmissionState getState() {
        return state;
    }

    public Optional<ApprovalResult> getApprovalResult() {
        return Optional.ofNullable(approvalResult);
    }

    /**
     * User-facing text: next steps for REJECTED, the retry message for FAILED.
     */
    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    public Optional<SubmissionFailure> getFailure() {
        return Optional.ofNullable(failure);
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    // ─────────────────── Identity ───────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        SubmissionAttempt that = (SubmissionAttempt) o;
        return Objects.equals(attemptId, that.attemptId)
                && state == that.state;
    }

    @Override
    public int hashCode() {
        return Objects.hash(attemptId, state);
    }

    @Override
    public String toString() {
        return "SubmissionAttempt{attemptId='" + attemptId
                + "', actorId='" + actorId
                + "', claimId='" + claimId
                + "', state=" + state
                + (failure != null ? ", failureStage=" + failure.stage() : "")
                + ", startedAt=" + startedAt + "}";
    }
}
