package com.insurance.claims.application.port.out;

/**
 * Secondary (outbound) port: out-of-band status updates for claims under review.
 * Fire-and-forget.
 */
public interface StatusScheduler {

    /**
     * Subscribes the submitter to status updates of a claim.
     *
     * @param claimId claim identifier returned by the Decision Service
     */
    void scheduleUpdates(String claimId);
}
