package com.insurance.claims.domain.valueobject;

/**
 * Lifecycle position of one claim submission attempt.
 * <p>
 * Terminal states (APPROVED, UNDER_REVIEW, REJECTED, FAILED) end the attempt.
 * UNDER_REVIEW may still change on the Decision Service side, but nothing in
 * this pipeline moves it further.
 * </p>
 *
 * <pre>
 * State Machine Flow:
 *   IDLE → VALIDATING → UPLOADING_MEDIA → SUBMITTING → APPROVED
 *                                                    → UNDER_REVIEW
 *                                                    → REJECTED
 *   VALIDATING | UPLOADING_MEDIA | SUBMITTING → FAILED
 * </pre>
 */
public enum SubmissionState {

    /** No attempt started yet */
    IDLE,

    /** Gate checks running (amount, incident date, rate limit) */
    VALIDATING,

    /** Evidence media being compressed and uploaded */
    UPLOADING_MEDIA,

    /** Claim sent to the Decision Service, awaiting classification */
    SUBMITTING,

    /** Instantly approved with payout terms - terminal state */
    APPROVED,

    /** Routed to a claims specialist - terminal for this pipeline */
    UNDER_REVIEW,

    /** Rejected or flagged by the Decision Service - terminal state */
    REJECTED,

    /** A stage failed; the attempt carries the failure detail - terminal state */
    FAILED;

    /**
     * @return true if no further transition is possible for this attempt
     */
    public boolean isTerminal() {
        return this == APPROVED || this == UNDER_REVIEW || this == REJECTED || this == FAILED;
    }

    /**
     * @return true while a stage of the pipeline is still running
     */
    public boolean isInFlight() {
        return this == VALIDATING || this == UPLOADING_MEDIA || this == SUBMITTING;
    }

    /**
     * @return true for the terminal states produced by a successful Decision Service call
     */
    public boolean isDecided() {
        return this == APPROVED || this == UNDER_REVIEW || this == REJECTED;
    }
}
