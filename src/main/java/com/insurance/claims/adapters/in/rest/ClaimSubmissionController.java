package com.insurance.claims.adapters.in.rest;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import com.insurance.claims.application.port.in.SubmitClaimUseCase;
import com.insurance.claims.application.port.out.SubmissionAuditLog;
import com.insurance.claims.bootstrap.config.ClaimsProperties;
import com.insurance.claims.domain.entity.ClaimRequest;
import com.insurance.claims.domain.entity.SubmissionAttempt;
import com.insurance.claims.domain.valueobject.ClaimType;
import com.insurance.claims.domain.valueobject.IncidentLocation;

/**
 * REST inbound adapter for claim submissions.
 * <p>
 * Submission is asynchronous: {@code POST} answers 202 once the attempt passed
 * the gate, and clients follow the attempt with {@code GET} (or via the
 * submission-events topic). Gate and concurrency refusals are answered
 * immediately, see {@link SubmissionExceptionHandler}. Bodies missing a
 * required field, or with ids longer than the audit log stores, are answered
 * 400 before the pipeline is touched.
 * </p>
 */
@RestController
@RequestMapping("/api/claims")
public class ClaimSubmissionController {

    private static final Logger log = LoggerFactory.getLogger(ClaimSubmissionController.class);

    private final SubmitClaimUseCase submitClaimUseCase;
    private final SubmissionAuditLog auditLog;
    private final int defaultHistoryLimit;

    public ClaimSubmissionController(SubmitClaimUseCase submitClaimUseCase,
            SubmissionAuditLog auditLog,
            ClaimsProperties claimsProperties) {
        this.submitClaimUseCase = submitClaimUseCase;
        this.auditLog = auditLog;
        this.defaultHistoryLimit = Math.max(1, claimsProperties.getAudit().getHistoryLimit());
    }

    /**
     * Starts a submission.
     * <p>
     * Usage: POST /api/claims/submissions
     * </p>
     */
    @PostMapping("/submissions")
    public ResponseEntity<Map<String, Object>> submit(@Valid @RequestBody SubmitClaimRequest body) {
        ClaimRequest request = body.toDomain();
        try {
            MDC.put("actorId", String.valueOf(request.getActorId()));
            MDC.put("claimId", request.getClaimId());

            CompletableFuture<SubmissionAttempt> pending = submitClaimUseCase.submitClaim(request);
            SubmissionAttempt attempt = acceptedAttempt(request, pending);
            log.info("action=submission_accepted actorId={} claimId={} attemptId={} state={}",
                    request.getActorId(), request.getClaimId(), attempt.getAttemptId(), attempt.getState());

            return ResponseEntity.status(HttpStatus.ACCEPTED).body(toResponse(attempt));
        } finally {
            MDC.remove("actorId");
            MDC.remove("claimId");
        }
    }

    /**
     * Latest attempt of an actor.
     * <p>
     * Usage: GET /api/claims/submissions/{actorId}
     * </p>
     */
    @GetMapping("/submissions/{actorId}")
    public ResponseEntity<Map<String, Object>> current(@PathVariable String actorId) {
        Optional<SubmissionAttempt> attempt = submitClaimUseCase.currentAttempt(actorId);

        if (attempt.isEmpty()) {
            return ResponseEntity.ok(Map.of(
                    "actorId", actorId,
                    "status", "no_active_submission"));
        }
        return ResponseEntity.ok(toResponse(attempt.get()));
    }

    /**
     * Audit history of an actor's submissions.
     * <p>
     * Usage: GET /api/claims/submissions/{actorId}/history?limit=20
     * </p>
     */
    @GetMapping("/submissions/{actorId}/history")
    public ResponseEntity<Map<String, Object>> history(@PathVariable String actorId,
            @RequestParam(name = "limit", required = false) Integer limit) {
        int effectiveLimit = normalizeLimit(limit);
        List<Map<String, Object>> events = auditLog.findByActorId(actorId, effectiveLimit).stream()
                .map(ClaimSubmissionController::toHistoryItem)
                .collect(Collectors.toList());

        return ResponseEntity.ok(Map.of(
                "actorId", actorId,
                "events", events,
                "limit", effectiveLimit));
    }

    // ─────────────────── Private Helpers ───────────────────

    /**
     * Snapshot of the attempt this request started. The actor's current attempt
     * is only used while it still belongs to this claim.
     */
    private SubmissionAttempt acceptedAttempt(ClaimRequest request, CompletableFuture<SubmissionAttempt> pending) {
        if (pending.isDone()) {
            return pending.join();
        }
        // Replaced or evicted only after this attempt finished, so the future is completing
        return submitClaimUseCase.currentAttempt(request.getActorId())
                .filter(attempt -> request.getClaimId().equals(attempt.getClaimId()))
                .orElseGet(pending::join);
    }

    private int normalizeLimit(Integer limit) {
        int candidate = limit != null ? limit : defaultHistoryLimit;
        return Math.min(Math.max(candidate, 1), 100);
    }

    static Map<String, Object> toResponse(SubmissionAttempt attempt) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("attemptId", attempt.getAttemptId());
        response.put("actorId", attempt.getActorId());
        response.put("claimId", attempt.getClaimId());
        response.put("state", attempt.getState().name());
        attempt.getApprovalResult().ifPresent(result -> response.put("approval", Map.of(
                "amount", result.getAmount(),
                "processingTimeMillis", result.getProcessingTimeMillis())));
        attempt.getMessage().ifPresent(message -> response.put("message", message));
        attempt.getFailure().ifPresent(failure -> response.put("failureStage", failure.stage().name()));
        response.put("startedAt", attempt.getStartedAt().toString());
        response.put("updatedAt", attempt.getUpdatedAt().toString());
        return response;
    }

    private static Map<String, Object> toHistoryItem(SubmissionAuditLog.AuditEntry entry) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("eventId", entry.eventId());
        item.put("attemptId", entry.attemptId());
        item.put("claimId", entry.claimId());
        item.put("eventType", entry.eventType());
        item.put("state", entry.state());
        if (entry.failureStage() != null) {
            item.put("failureStage", entry.failureStage());
        }
        if (entry.message() != null) {
            item.put("message", entry.message());
        }
        item.put("occurredAt", entry.occurredAt().toString());
        return item;
    }

    // ─────────────────── Inner DTO ───────────────────

    /**
     * JSON body of a submission.
     */
    public static class SubmitClaimRequest {

        // Lengths match the submission_events columns
        @Size(max = 64, message = "claimId must not exceed 64 characters")
        private String claimId;

        @NotBlank(message = "actorId is required")
        @Size(max = 128, message = "actorId must not exceed 128 characters")
        private String actorId;

        @NotBlank(message = "policyId is required")
        private String policyId;

        @NotNull(message = "claimType is required")
        private ClaimType claimType;

        @NotBlank(message = "description is required")
        private String description;

        private BigDecimal estimatedAmount;
        private Instant incidentDate;

        @NotNull(message = "location is required")
        @Valid
        private LocationRequest location;

        private List<@NotBlank String> photos;
        private String localMediaReference;

        public ClaimRequest toDomain() {
            ClaimRequest request = new ClaimRequest(actorId, estimatedAmount, incidentDate);
            if (claimId != null && !claimId.isBlank()) {
                request.setClaimId(claimId);
            }
            request.setPolicyId(policyId);
            request.setClaimType(claimType);
            request.setDescription(description);
            if (location != null) {
                request.setLocation(new IncidentLocation(location.getLat(), location.getLng()));
            }
            request.setPhotoReferences(photos);
            request.setLocalMediaReference(localMediaReference);
            return request;
        }

        // Getters/Setters for Jackson
        public String getClaimId() {
            return claimId;
        }

        public void setClaimId(String claimId) {
            this.claimId = claimId;
        }

        public String getActorId() {
            return actorId;
        }

        public void setActorId(String actorId) {
            this.actorId = actorId;
        }

        public String getPolicyId() {
            return policyId;
        }

        public void setPolicyId(String policyId) {
            this.policyId = policyId;
        }

        public ClaimType getClaimType() {
            return claimType;
        }

        public void setClaimType(ClaimType claimType) {
            this.claimType = claimType;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public BigDecimal getEstimatedAmount() {
            return estimatedAmount;
        }

        public void setEstimatedAmount(BigDecimal estimatedAmount) {
            this.estimatedAmount = estimatedAmount;
        }

        public Instant getIncidentDate() {
            return incidentDate;
        }

        public void setIncidentDate(Instant incidentDate) {
            this.incidentDate = incidentDate;
        }

        public LocationRequest getLocation() {
            return location;
        }

        public void setLocation(LocationRequest location) {
            this.location = location;
        }

        public List<String> getPhotos() {
            return photos;
        }

        public void setPhotos(List<String> photos) {
            this.photos = photos;
        }

        public String getLocalMediaReference() {
            return localMediaReference;
        }

        public void setLocalMediaReference(String localMediaReference) {
            this.localMediaReference = localMediaReference;
        }
    }

    /**
     * Incident coordinates, {@code {"lat": 40.71, "lng": -74.00}}.
     */
    public static class LocationRequest {

        @NotNull(message = "lat is required")
        @DecimalMin(value = "-90.0", message = "lat must be >= -90")
        @DecimalMax(value = "90.0", message = "lat must be <= 90")
        private Double lat;

        @NotNull(message = "lng is required")
        @DecimalMin(value = "-180.0", message = "lng must be >= -180")
        @DecimalMax(value = "180.0", message = "lng must be <= 180")
        private Double lng;

        public Double getLat() {
            return lat;
        }

        public void setLat(Double lat) {
            this.lat = lat;
        }

        public Double getLng() {
            return lng;
        }

        public void setLng(Double lng) {
            this.lng = lng;
        }
    }
}
