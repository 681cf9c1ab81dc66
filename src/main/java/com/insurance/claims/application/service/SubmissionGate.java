package com.insurance.claims.application.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.insurance.claims.application.port.out.RateLimiter;
import com.insurance.claims.domain.entity.ClaimRequest;
import com.insurance.claims.domain.valueobject.ValidationFailureReason;
import com.insurance.claims.domain.valueobject.ValidationResult;

/**
 * Refuses invalid or abusive submissions before any upload or network cost.
 * <p>
 * Checks run in order and stop at the first failure:
 * <ol>
 * <li>estimated amount strictly greater than zero and below {@link #MAX_ESTIMATED_AMOUNT}</li>
 * <li>incident date strictly before now</li>
 * <li>rate-limiting oracle does not report the actor</li>
 * </ol>
 * The only side effect is the rate-limit query.
 * </p>
 */
public class SubmissionGate {

    private static final Logger log = LoggerFactory.getLogger(SubmissionGate.class);

    /** Exclusive upper bound the Decision Service accepts. */
    public static final BigDecimal MAX_ESTIMATED_AMOUNT = new BigDecimal("1000000");

    private final RateLimiter rateLimiter;
    private final Clock clock;

    public SubmissionGate(RateLimiter rateLimiter, Clock clock) {
        if (rateLimiter == null)
            throw new IllegalArgumentException("rateLimiter cannot be null");
        if (clock == null)
            throw new IllegalArgumentException("clock cannot be null");

        this.rateLimiter = rateLimiter;
        this.clock = clock;
    }

    /**
     * Validates a claim draft.
     *
     * @param request claim draft, read only
     * @return passed, or the first failed check
     */
    public ValidationResult validate(ClaimRequest request) {
        BigDecimal amount = request.getEstimatedAmount();
        if (amount == null || amount.signum() <= 0 || amount.compareTo(MAX_ESTIMATED_AMOUNT) >= 0) {
            return refuse(request, ValidationFailureReason.AMOUNT_INVALID);
        }

        Instant incidentDate = request.getIncidentDate();
        if (incidentDate == null || !incidentDate.isBefore(clock.instant())) {
            return refuse(request, ValidationFailureReason.DATE_INVALID);
        }

        if (rateLimiter.isSubmittingTooFrequently(request.getActorId())) {
            return refuse(request, ValidationFailureReason.RATE_LIMITED);
        }

        log.debug("action=gate_passed actorId={} claimId={}", request.getActorId(), request.getClaimId());
        return ValidationResult.passed();
    }

    private ValidationResult refuse(ClaimRequest request, ValidationFailureReason reason) {
        log.info("action=gate_refused actorId={} claimId={} reason={} field={}",
                request.getActorId(), request.getClaimId(), reason, reason.getField());
        return ValidationResult.failed(reason);
    }
}
