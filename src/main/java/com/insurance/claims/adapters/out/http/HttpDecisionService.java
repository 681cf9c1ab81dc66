package com.insurance.claims.adapters.out.http;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import com.insurance.claims.application.port.out.DecisionService;
import com.insurance.claims.bootstrap.config.ClaimsProperties;
import com.insurance.claims.domain.entity.ClaimRequest;
import com.insurance.claims.domain.entity.DecisionOutcome;
import com.insurance.claims.domain.exception.DecisionServiceException;
import com.insurance.claims.domain.valueobject.DecisionStatus;
import com.insurance.claims.domain.valueobject.IncidentLocation;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * HTTP implementation of the DecisionService outbound port.
 * <p>
 * {@code POST {base-url}/v1/claims} with a snake_case JSON claim; the response
 * carries {@code status} (instant_approved, under_review, rejected, flagged)
 * and the matching payload. The blocking call runs on the pipeline executor.
 * No retries: resubmitting a claim could create a duplicate.
 * </p>
 */
@Component
public class HttpDecisionService implements DecisionService {

    private static final Logger log = LoggerFactory.getLogger(HttpDecisionService.class);
    private static final String CLAIMS_PATH = "/v1/claims";

    private final RestTemplate restTemplate;
    private final Executor executor;
    private final String claimsUrl;

    public HttpDecisionService(@Qualifier("decisionRestTemplate") RestTemplate restTemplate,
            @Qualifier("claimsPipelineExecutor") Executor executor,
            ClaimsProperties claimsProperties) {
        this.restTemplate = restTemplate;
        this.executor = executor;
        this.claimsUrl = stripTrailingSlash(claimsProperties.getDecision().getBaseUrl()) + CLAIMS_PATH;
    }

    @Override
    public CompletableFuture<DecisionOutcome> submit(ClaimRequest claim) {
        return CompletableFuture.supplyAsync(() -> call(claim), executor);
    }

    DecisionOutcome call(ClaimRequest claim) {
        ClaimSubmissionDto body = ClaimSubmissionDto.fromDomain(claim);
        log.info("action=decision_request claimId={} url={} hasEvidence={}",
                claim.getClaimId(), claimsUrl, body.videoEvidenceUrl != null);

        ResponseEntity<ClaimDecisionDto> response;
        try {
            response = restTemplate.postForEntity(claimsUrl, body, ClaimDecisionDto.class);
        } catch (RestClientResponseException e) {
            log.error("action=decision_http_error claimId={} status={} error={}",
                    claim.getClaimId(), e.getStatusCode().value(), e.getMessage());
            throw new DecisionServiceException(
                    "Decision Service returned HTTP " + e.getStatusCode().value(), e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            log.error("action=decision_io_error claimId={} error={}", claim.getClaimId(), e.getMessage());
            throw new DecisionServiceException("Decision Service unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            log.error("action=decision_client_error claimId={} error={}", claim.getClaimId(), e.getMessage());
            throw new DecisionServiceException("Decision Service call failed: " + e.getMessage(), e);
        }

        ClaimDecisionDto dto = response.getBody();
        if (dto == null) {
            throw new DecisionServiceException("Decision Service returned an empty body");
        }
        try {
            DecisionOutcome outcome = dto.toDomain();
            log.info("action=decision_response claimId={} status={} processingTimeMs={}",
                    outcome.getClaimId(), outcome.getStatus(), dto.processingTimeMs);
            return outcome;
        } catch (IllegalArgumentException e) {
            log.error("action=decision_malformed claimId={} error={}", claim.getClaimId(), e.getMessage());
            throw new DecisionServiceException("Malformed Decision Service response: " + e.getMessage(), e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // ─────────────────── Inner DTOs ───────────────────

    /**
     * Request body of the claims endpoint.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ClaimSubmissionDto {

        @JsonProperty("claim_id")
        public String claimId;

        @JsonProperty("policy_id")
        public String policyId;

        @JsonProperty("user_id")
        public String userId;

        @JsonProperty("claim_type")
        public String claimType;

        @JsonProperty("incident_date")
        public String incidentDate;

        @JsonProperty("description")
        public String description;

        @JsonProperty("estimated_amount")
        public BigDecimal estimatedAmount;

        @JsonProperty("video_evidence_url")
        public String videoEvidenceUrl;

        // Always sent, empty when no photos were attached
        @JsonProperty("photos")
        @JsonInclude(JsonInclude.Include.ALWAYS)
        public List<String> photos = new ArrayList<>();

        @JsonProperty("location")
        public LocationDto location;

        public static ClaimSubmissionDto fromDomain(ClaimRequest claim) {
            ClaimSubmissionDto dto = new ClaimSubmissionDto();
            dto.claimId = claim.getClaimId();
            dto.policyId = claim.getPolicyId();
            dto.userId = claim.getActorId();
            dto.claimType = claim.getClaimType() != null ? claim.getClaimType().getWireValue() : null;
            dto.incidentDate = claim.getIncidentDate() != null ? claim.getIncidentDate().toString() : null;
            dto.description = claim.getDescription();
            dto.estimatedAmount = claim.getEstimatedAmount();
            dto.videoEvidenceUrl = claim.getMediaEvidenceReference();
            dto.photos = new ArrayList<>(claim.getPhotoReferences());
            dto.location = LocationDto.fromDomain(claim.getLocation());
            return dto;
        }
    }

    /**
     * Incident coordinates, {@code {"lat": .., "lng": ..}}.
     */
    public static class LocationDto {

        @JsonProperty("lat")
        public double lat;

        @JsonProperty("lng")
        public double lng;

        static LocationDto fromDomain(IncidentLocation location) {
            if (location == null) {
                return null;
            }
            LocationDto dto = new LocationDto();
            dto.lat = location.latitude();
            dto.lng = location.longitude();
            return dto;
        }
    }

    /**
     * Response body of the claims endpoint.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ClaimDecisionDto {

        @JsonProperty("claim_id")
        public String claimId;

        @JsonProperty("status")
        public String status;

        @JsonProperty("payout_amount")
        public BigDecimal payoutAmount;

        @JsonProperty("processing_time_ms")
        public Long processingTimeMs;

        @JsonProperty("confidence_score")
        public Double confidenceScore;

        @JsonProperty("next_steps")
        public String nextSteps;

        public DecisionOutcome toDomain() {
            DecisionOutcome outcome = switch (DecisionStatus.fromWireValue(status)) {
                case INSTANT_APPROVED -> DecisionOutcome.instantApproved(claimId, payoutAmount,
                        processingTimeMs != null ? processingTimeMs : 0L);
                case UNDER_REVIEW -> DecisionOutcome.underReview(claimId, nextSteps);
                case REJECTED -> DecisionOutcome.rejected(claimId, nextSteps);
                case FLAGGED -> DecisionOutcome.flagged(claimId, nextSteps);
            };
            return outcome.withConfidenceScore(confidenceScore);
        }
    }
}
