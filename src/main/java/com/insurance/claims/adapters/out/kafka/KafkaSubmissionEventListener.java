package com.insurance.claims.adapters.out.kafka;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import com.insurance.claims.application.port.out.SubmissionEventListener;
import com.insurance.claims.bootstrap.config.ClaimsProperties;
import com.insurance.claims.domain.entity.SubmissionAttempt;
import com.insurance.claims.domain.entity.SubmissionEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Forwards submission events to the presentation layer over Kafka.
 * <p>
 * Topic {@code claims.submission-events}, keyed by actorId so one actor's
 * events keep their order within a partition.
 * </p>
 */
@Component
public class KafkaSubmissionEventListener implements SubmissionEventListener {

    private static final Logger log = LoggerFactory.getLogger(KafkaSubmissionEventListener.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String eventsTopic;
    private final long publishAckTimeoutMs;

    private final Counter publishSuccess;
    private final Counter publishFailure;
    private final Timer publishLatency;

    public KafkaSubmissionEventListener(KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            ClaimsProperties claimsProperties,
            MeterRegistry meterRegistry) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.eventsTopic = claimsProperties.getKafka().getTopics().getSubmissionEvents();
        this.publishAckTimeoutMs = claimsProperties.getKafka().getPublishAckTimeoutMs();

        this.publishSuccess = meterRegistry.counter("claims.event.publish.outcome", "status", "success");
        this.publishFailure = meterRegistry.counter("claims.event.publish.outcome", "status", "failure");
        this.publishLatency = meterRegistry.timer("claims.event.publish.latency");
    }

    @Override
    public void onEvent(SubmissionEvent event) {
        Timer.Sample sample = Timer.start();
        try {
            String json = serializeEvent(event);
            SendResult<String, String> sendResult = kafkaTemplate.send(eventsTopic, event.getActorId(), json)
                    .get(publishAckTimeoutMs, TimeUnit.MILLISECONDS);

            log.info("action=event_published eventId={} type={} attemptId={} state={} topic={} partition={} offset={}",
                    event.getEventId(), event.getType(), event.getAttemptId(), event.getState(),
                    sendResult.getRecordMetadata().topic(),
                    sendResult.getRecordMetadata().partition(),
                    sendResult.getRecordMetadata().offset());
            publishSuccess.increment();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            publishFailure.increment();
            throw new IllegalStateException("Interrupted publishing event " + event.getEventId(), e);
        } catch (Exception e) {
            publishFailure.increment();
            log.error("action=event_publish_failed eventId={} attemptId={} error={}",
                    event.getEventId(), event.getAttemptId(), e.getMessage(), e);
            throw new IllegalStateException("Event publish failed for eventId=" + event.getEventId(), e);
        } finally {
            sample.stop(publishLatency);
        }
    }

    String serializeEvent(SubmissionEvent event) {
        SubmissionAttempt attempt = event.getAttempt();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event_id", event.getEventId());
        payload.put("event_type", event.getType().getWireName());
        payload.put("attempt_id", attempt.getAttemptId());
        payload.put("actor_id", attempt.getActorId());
        payload.put("claim_id", attempt.getClaimId());
        payload.put("state", attempt.getState().name());
        payload.put("occurred_at", event.getOccurredAt().toString());
        attempt.getApprovalResult().ifPresent(result -> {
            payload.put("payout_amount", result.getAmount());
            payload.put("processing_time_ms", result.getProcessingTimeMillis());
        });
        attempt.getMessage().ifPresent(message -> payload.put("message", message));
        attempt.getFailure().ifPresent(failure -> payload.put("failure_stage", failure.stage().name()));

        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize submission event", e);
        }
    }
}
