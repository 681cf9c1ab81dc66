package com.insurance.claims.application.port.in;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import com.insurance.claims.application.port.out.SubmissionEventListener;
import com.insurance.claims.domain.entity.ClaimRequest;
import com.insurance.claims.domain.entity.SubmissionAttempt;

/**
 * Primary (inbound) port: entry point of the claim submission pipeline.
 * <p>
 * Drives one attempt through the stages:
 * <ol>
 * <li><b>Gate</b>: amount, incident date and rate-limit checks</li>
 * <li><b>Media</b>: compress and upload evidence, if any was captured</li>
 * <li><b>Decide</b>: submit to the Decision Service and map the outcome</li>
 * </ol>
 * </p>
 */
public interface SubmitClaimUseCase {

    /**
     * Starts a submission attempt for the claim's actor.
     * <p>
     * Validation and concurrency problems are raised before this method
     * returns. Media and Decision Service failures are reported through the
     * returned future, which always completes normally with the terminal
     * attempt (APPROVED, UNDER_REVIEW, REJECTED or FAILED).
     * </p>
     *
     * @param request claim draft; the evidence reference is attached to it
     * @return future of the terminal attempt snapshot
     * @throws com.insurance.claims.domain.exception.ConcurrentSubmissionException
     *         if the actor already has an attempt in flight
     * @throws com.insurance.claims.domain.exception.ClaimValidationException
     *         if the gate refused the claim
     */
    CompletableFuture<SubmissionAttempt> submitClaim(ClaimRequest request);

    /**
     * Latest attempt of an actor, running or finished.
     *
     * @param actorId submitter
     * @return latest attempt, or empty if the actor never submitted
     */
    Optional<SubmissionAttempt> currentAttempt(String actorId);

    /**
     * Registers a listener for state transitions and presentation events.
     */
    void subscribe(SubmissionEventListener listener);

    void unsubscribe(SubmissionEventListener listener);
}
