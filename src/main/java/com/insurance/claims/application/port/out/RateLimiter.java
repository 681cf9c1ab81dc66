package com.insurance.claims.application.port.out;

/**
 * Secondary (outbound) port: rate-limiting oracle for fraud deterrence.
 */
public interface RateLimiter {

    /**
     * Reports whether the actor has submitted claims too frequently.
     * Implementations may count this query as a submission.
     *
     * @param actorId submitter
     * @return true if the submission must be refused
     */
    boolean isSubmittingTooFrequently(String actorId);
}
