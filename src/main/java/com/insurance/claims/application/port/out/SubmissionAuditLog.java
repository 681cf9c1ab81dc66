package com.insurance.claims.application.port.out;

import java.time.Instant;
import java.util.List;

/**
 * Secondary (outbound) port: audit trail of submission events.
 * <p>
 * Writes arrive as {@link SubmissionEventListener} callbacks and must be
 * idempotent (same eventId = no-op).
 * </p>
 */
public interface SubmissionAuditLog extends SubmissionEventListener {

    /**
     * Retrieves an actor's submission events, most recent first.
     *
     * @param actorId submitter
     * @param limit   maximum entries to return
     * @return audit entries ordered by time desc
     */
    List<AuditEntry> findByActorId(String actorId, int limit);

    /**
     * One persisted event.
     */
    record AuditEntry(
            String eventId,
            String attemptId,
            String actorId,
            String claimId,
            String eventType,
            String state,
            String failureStage,
            String message,
            Instant occurredAt) {
    }
}
