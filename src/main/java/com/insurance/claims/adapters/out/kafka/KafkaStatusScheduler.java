package com.insurance.claims.adapters.out.kafka;

import java.time.Instant;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import com.insurance.claims.application.port.out.StatusScheduler;
import com.insurance.claims.bootstrap.config.ClaimsProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Kafka implementation of the StatusScheduler outbound port.
 * <p>
 * Publishes a subscription request to {@code claims.status-subscriptions},
 * keyed by claimId. The notification service owns the schedule from there.
 * Fire-and-forget: the send result is only logged.
 * </p>
 */
@Component
public class KafkaStatusScheduler implements StatusScheduler {

    private static final Logger log = LoggerFactory.getLogger(KafkaStatusScheduler.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String subscriptionsTopic;

    public KafkaStatusScheduler(KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            ClaimsProperties claimsProperties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.subscriptionsTopic = claimsProperties.getKafka().getTopics().getStatusSubscriptions();
    }

    @Override
    public void scheduleUpdates(String claimId) {
        if (claimId == null || claimId.isBlank()) {
            throw new IllegalArgumentException("claimId cannot be null or blank");
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(Map.of(
                    "claim_id", claimId,
                    "requested_at", Instant.now().toString()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize status subscription", e);
        }

        kafkaTemplate.send(subscriptionsTopic, claimId, json).whenComplete((result, error) -> {
            if (error != null) {
                log.error("action=status_subscription_failed claimId={} error={}", claimId, error.getMessage());
            } else {
                log.info("action=status_subscription_sent claimId={} partition={} offset={}",
                        claimId, result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
            }
        });
    }
}
