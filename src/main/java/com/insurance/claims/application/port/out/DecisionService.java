package com.insurance.claims.application.port.out;

import java.util.concurrent.CompletableFuture;

import com.insurance.claims.domain.entity.ClaimRequest;
import com.insurance.claims.domain.entity.DecisionOutcome;

/**
 * Secondary (outbound) port: claim adjudication.
 */
public interface DecisionService {

    /**
     * Submits the claim and returns its classification.
     * <p>
     * A rejected or flagged claim completes normally. The future completes
     * exceptionally only when no decision could be obtained.
     * </p>
     *
     * @param claim claim with its evidence reference attached
     * @return decision outcome
     */
    CompletableFuture<DecisionOutcome> submit(ClaimRequest claim);
}
