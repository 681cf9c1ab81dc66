package com.insurance.claims.application.service;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import com.insurance.claims.domain.entity.ApprovalResult;
import com.insurance.claims.domain.entity.DecisionOutcome;
import com.insurance.claims.domain.entity.SubmissionAttempt;
import com.insurance.claims.domain.entity.SubmissionFailure;
import com.insurance.claims.domain.exception.ClaimValidationException;
import com.insurance.claims.domain.exception.DecisionServiceException;
import com.insurance.claims.domain.exception.MediaPipelineException;
import com.insurance.claims.domain.valueobject.FailureStage;
import com.insurance.claims.domain.valueobject.SubmissionEventType;
import com.insurance.claims.domain.valueobject.SubmissionState;

/**
 * Stateless mapping from Decision Service outcomes and stage errors to
 * attempt transitions and presentation events.
 *
 * <p>
 * <b>Thread-safe:</b> This service has no mutable state.
 * </p>
 * <p>
 * <b>Deterministic:</b> Same inputs always produce the same outputs.
 * </p>
 */
public class DecisionOutcomeMapper {

    // ─────────────────── Message Templates ───────────────────
    static final String MSG_SUBMISSION_FAILED = "We couldn't submit your claim right now. Please try again.";
    static final String MSG_REJECTED_DEFAULT = "Your claim could not be approved. Please contact support for next steps.";

    /**
     * Terminal state a decision leads to. FLAGGED collapses into REJECTED.
     */
    public SubmissionState determineTerminalState(DecisionOutcome outcome) {
        return switch (outcome.getStatus()) {
            case INSTANT_APPROVED -> SubmissionState.APPROVED;
            case UNDER_REVIEW -> SubmissionState.UNDER_REVIEW;
            case REJECTED, FLAGGED -> SubmissionState.REJECTED;
        };
    }

    /**
     * Applies a decision to an attempt in SUBMITTING.
     *
     * @param submitting attempt waiting for the decision
     * @param outcome    Decision Service classification
     * @return a NEW attempt in the terminal state
     * @throws IllegalArgumentException if an approval carries unusable payout terms
     */
    public SubmissionAttempt applyOutcome(SubmissionAttempt submitting, DecisionOutcome outcome) {
        return switch (determineTerminalState(outcome)) {
            case APPROVED -> submitting.approve(toApprovalResult(outcome));
            case UNDER_REVIEW -> submitting.transitionTo(SubmissionState.UNDER_REVIEW);
            case REJECTED -> submitting.reject(rejectionMessage(outcome));
            default -> throw new IllegalStateException("Unmapped decision: " + outcome.getStatus());
        };
    }

    /**
     * Builds payout terms from an instant approval.
     */
    public ApprovalResult toApprovalResult(DecisionOutcome outcome) {
        BigDecimal amount = outcome.getPayoutAmount()
                .orElseThrow(() -> new IllegalArgumentException(
                        "instant approval without payout amount for claim " + outcome.getClaimId()));
        long processingTime = outcome.getProcessingTimeMillis().orElse(0L);
        return new ApprovalResult(amount, processingTime);
    }

    /**
     * Presentation events that follow the STATE_CHANGED event of a terminal
     * attempt. Only instant approvals produce any.
     */
    public List<SubmissionEventType> presentationEvents(SubmissionAttempt terminal) {
        if (terminal.getState() == SubmissionState.APPROVED) {
            return List.of(SubmissionEventType.SUBMISSION_SUCCEEDED, SubmissionEventType.CELEBRATE);
        }
        return List.of();
    }

    /**
     * Attributes an error to a pipeline stage.
     * <p>
     * Typed pipeline errors carry their own stage. Anything else is attributed
     * to the stage the attempt was in when the error surfaced.
     * </p>
     *
     * @param error        error raised by a stage, possibly wrapped by a future
     * @param currentState state of the attempt when the error surfaced
     * @return failure detail for the FAILED transition
     */
    public SubmissionFailure toFailure(Throwable error, SubmissionState currentState) {
        Throwable cause = unwrap(error);
        String description = cause.getClass().getSimpleName()
                + (cause.getMessage() != null ? ": " + cause.getMessage() : "");

        if (cause instanceof ClaimValidationException) {
            ClaimValidationException validation = (ClaimValidationException) cause;
            return new SubmissionFailure(FailureStage.VALIDATION, validation.getReason().name(),
                    validation.getReason().getMessage());
        }
        if (cause instanceof MediaPipelineException) {
            FailureStage stage = ((MediaPipelineException) cause).getStage();
            return new SubmissionFailure(stage, description, MSG_SUBMISSION_FAILED);
        }
        if (cause instanceof DecisionServiceException) {
            return new SubmissionFailure(FailureStage.DECISION_SERVICE, description, MSG_SUBMISSION_FAILED);
        }
        return new SubmissionFailure(stageOf(currentState), description, MSG_SUBMISSION_FAILED);
    }

    /**
     * State an attempt must be in for a failure of the given stage to apply.
     */
    public SubmissionState expectedStateFor(FailureStage stage) {
        return switch (stage) {
            case VALIDATION -> SubmissionState.VALIDATING;
            case MEDIA_COMPRESSION, MEDIA_UPLOAD -> SubmissionState.UPLOADING_MEDIA;
            case DECISION_SERVICE -> SubmissionState.SUBMITTING;
        };
    }

    // ─────────────────── Private Helpers ───────────────────

    private FailureStage stageOf(SubmissionState state) {
        return switch (state) {
            case IDLE, VALIDATING -> FailureStage.VALIDATION;
            case UPLOADING_MEDIA -> FailureStage.MEDIA_UPLOAD;
            default -> FailureStage.DECISION_SERVICE;
        };
    }

    private String rejectionMessage(DecisionOutcome outcome) {
        String nextSteps = outcome.getNextSteps();
        return (nextSteps == null || nextSteps.isBlank()) ? MSG_REJECTED_DEFAULT : nextSteps;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
