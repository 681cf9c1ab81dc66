package com.insurance.claims.domain.entity;

import java.math.BigDecimal;
import java.util.Optional;

import com.insurance.claims.domain.valueobject.DecisionStatus;

/**
 * Classification returned by the Decision Service, with the payload that
 * belongs to it.
 *
 * <ul>
 * <li>INSTANT_APPROVED: payout amount and processing latency</li>
 * <li>UNDER_REVIEW: claim identifier used for status-update subscriptions</li>
 * <li>REJECTED / FLAGGED: next-step guidance shown to the submitter</li>
 * </ul>
 */
public final class DecisionOutcome {

    private final DecisionStatus status;
    private final String claimId;
    private final BigDecimal payoutAmount;
    private final Long processingTimeMillis;
    private final String nextSteps;
    private final Double confidenceScore;

    private DecisionOutcome(DecisionStatus status, String claimId, BigDecimal payoutAmount,
            Long processingTimeMillis, String nextSteps, Double confidenceScore) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        this.status = status;
        this.claimId = claimId;
        this.payoutAmount = payoutAmount;
        this.processingTimeMillis = processingTimeMillis;
        this.nextSteps = nextSteps;
        this.confidenceScore = confidenceScore;
    }

    // ─────────────────── Factory Methods ───────────────────

    public static DecisionOutcome instantApproved(String claimId, BigDecimal payoutAmount,
            long processingTimeMillis) {
        if (payoutAmount == null) {
            throw new IllegalArgumentException("instant approval requires a payout amount");
        }
        return new DecisionOutcome(DecisionStatus.INSTANT_APPROVED, claimId, payoutAmount,
                processingTimeMillis, null, null);
    }

    public static DecisionOutcome underReview(String claimId, String nextSteps) {
        if (claimId == null || claimId.isBlank()) {
            throw new IllegalArgumentException("under_review outcome requires a claimId");
        }
        return new DecisionOutcome(DecisionStatus.UNDER_REVIEW, claimId, null, null, nextSteps, null);
    }

    public static DecisionOutcome rejected(String claimId, String nextSteps) {
        return new DecisionOutcome(DecisionStatus.REJECTED, claimId, null, null, nextSteps, null);
    }

    public static DecisionOutcome flagged(String claimId, String nextSteps) {
        return new DecisionOutcome(DecisionStatus.FLAGGED, claimId, null, null, nextSteps, null);
    }

    /**
     * Returns a copy carrying the model confidence reported with the decision.
     */
    public DecisionOutcome withConfidenceScore(Double confidenceScore) {
        return new DecisionOutcome(status, claimId, payoutAmount, processingTimeMillis,
                nextSteps, confidenceScore);
    }

    // ─────────────────── Getters ───────────────────

    public DecisionStatus getStatus() {
        return status;
    }

    public String getClaimId() {
        return claimId;
    }

    public Optional<BigDecimal> getPayoutAmount() {
        return Optional.ofNullable(payoutAmount);
    }

    public Optional<Long> getProcessingTimeMillis() {
        return Optional.ofNullable(processingTimeMillis);
    }

    public String getNextSteps() {
        return nextSteps;
    }

    public Optional<Double> getConfidenceScore() {
        return Optional.ofNullable(confidenceScore);
    }

    @Override
    public String toString() {
        return "DecisionOutcome{status=" + status
                + ", claimId='" + claimId
                + "', payoutAmount=" + payoutAmount
                + ", processingTimeMillis=" + processingTimeMillis + "}";
    }
}
