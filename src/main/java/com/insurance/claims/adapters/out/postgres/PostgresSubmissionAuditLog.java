package com.insurance.claims.adapters.out.postgres;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import com.insurance.claims.application.port.out.SubmissionAuditLog;
import com.insurance.claims.domain.entity.SubmissionAttempt;
import com.insurance.claims.domain.entity.SubmissionEvent;

/**
 * PostgreSQL implementation of the SubmissionAuditLog outbound port.
 * <p>
 * Uses JDBC with ON CONFLICT DO NOTHING for idempotent writes.
 * One row per submission event; claims themselves are not stored here.
 * </p>
 */
@Component
public class PostgresSubmissionAuditLog implements SubmissionAuditLog {

    private static final Logger log = LoggerFactory.getLogger(PostgresSubmissionAuditLog.class);

    // Idempotent insert: duplicate eventId silently ignored
    private static final String INSERT_EVENT_SQL = "INSERT INTO submission_events "
            + "(event_id, attempt_id, actor_id, claim_id, event_type, state, failure_stage, message, occurred_at) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?) "
            + "ON CONFLICT (event_id) DO NOTHING";

    private static final String SELECT_BY_ACTOR_SQL = "SELECT event_id, attempt_id, actor_id, claim_id, "
            + "event_type, state, failure_stage, message, occurred_at "
            + "FROM submission_events WHERE actor_id = ? "
            + "ORDER BY occurred_at DESC LIMIT ?";

    private final JdbcTemplate jdbcTemplate;

    public PostgresSubmissionAuditLog(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void onEvent(SubmissionEvent event) {
        SubmissionAttempt attempt = event.getAttempt();
        int rows = jdbcTemplate.update(
                INSERT_EVENT_SQL,
                event.getEventId(),
                attempt.getAttemptId(),
                attempt.getActorId(),
                attempt.getClaimId(),
                event.getType().getWireName(),
                attempt.getState().name(),
                attempt.getFailure().map(failure -> failure.stage().name()).orElse(null),
                attempt.getMessage().orElse(null),
                Timestamp.from(event.getOccurredAt()));

        if (rows > 0) {
            log.debug("action=audit_saved eventId={} attemptId={} state={}",
                    event.getEventId(), attempt.getAttemptId(), attempt.getState());
        } else {
            log.debug("action=audit_duplicate_skipped eventId={}", event.getEventId());
        }
    }

    @Override
    public List<AuditEntry> findByActorId(String actorId, int limit) {
        return jdbcTemplate.query(
                SELECT_BY_ACTOR_SQL,
                (rs, rowNum) -> mapRow(rs),
                actorId,
                limit);
    }

    private AuditEntry mapRow(ResultSet rs) throws SQLException {
        return new AuditEntry(
                rs.getString("event_id"),
                rs.getString("attempt_id"),
                rs.getString("actor_id"),
                rs.getString("claim_id"),
                rs.getString("event_type"),
                rs.getString("state"),
                rs.getString("failure_stage"),
                rs.getString("message"),
                rs.getTimestamp("occurred_at").toInstant());
    }
}
