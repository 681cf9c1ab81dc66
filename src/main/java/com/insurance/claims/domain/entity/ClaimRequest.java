package com.insurance.claims.domain.entity;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.insurance.claims.domain.valueobject.ClaimType;
import com.insurance.claims.domain.valueobject.IncidentLocation;

/**
 * Claim draft built by the submitter before it enters the submission pipeline.
 * <p>
 * <b>Mutable:</b> the caller fills the draft; once handed to the orchestrator
 * only the orchestrator writes to it, and only to attach the uploaded evidence
 * reference. The Decision Service reads it as-is. A draft is not reused after
 * its attempt reached a terminal state.
 * </p>
 */
public class ClaimRequest {

    private String claimId;
    private String actorId;
    private String policyId;
    private ClaimType claimType;
    private String description;
    private BigDecimal estimatedAmount;
    private Instant incidentDate;
    private IncidentLocation location;
    private List<String> photoReferences = new ArrayList<>();
    private String localMediaReference;
    private String mediaEvidenceReference;

    public ClaimRequest() {
        this.claimId = UUID.randomUUID().toString();
    }

    public ClaimRequest(String actorId, BigDecimal estimatedAmount, Instant incidentDate) {
        this();
        this.actorId = actorId;
        this.estimatedAmount = estimatedAmount;
        this.incidentDate = incidentDate;
    }

    // ─────────────────── Pipeline Mutation ───────────────────

    /**
     * Attaches the durable reference returned by the Media Pipeline.
     * A blank reference (no media was captured) leaves the evidence absent.
     *
     * @param reference remote reference, or empty when the upload was skipped
     */
    public void attachMediaEvidence(String reference) {
        this.mediaEvidenceReference = (reference == null || reference.isBlank()) ? null : reference;
    }

    /** @return true if the submitter captured media that still has to be uploaded */
    public boolean hasLocalMedia() {
        return localMediaReference != null && !localMediaReference.isBlank();
    }

    public Optional<String> getMediaEvidence() {
        return Optional.ofNullable(mediaEvidenceReference);
    }

    // ─────────────────── Getters / Setters ───────────────────

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

    public IncidentLocation getLocation() {
        return location;
    }

    public void setLocation(IncidentLocation location) {
        this.location = location;
    }

    /** @return already-uploaded photo references, never null */
    public List<String> getPhotoReferences() {
        return Collections.unmodifiableList(photoReferences);
    }

    public void setPhotoReferences(List<String> photoReferences) {
        this.photoReferences = photoReferences != null ? new ArrayList<>(photoReferences) : new ArrayList<>();
    }

    public String getLocalMediaReference() {
        return localMediaReference;
    }

    public void setLocalMediaReference(String localMediaReference) {
        this.localMediaReference = localMediaReference;
    }

    public String getMediaEvidenceReference() {
        return mediaEvidenceReference;
    }

    @Override
    public String toString() {
        return "ClaimRequest{claimId='" + claimId
                + "', actorId='" + actorId
                + "', claimType=" + claimType
                + ", estimatedAmount=" + estimatedAmount
                + ", incidentDate=" + incidentDate
                + ", photos=" + photoReferences.size()
                + ", hasLocalMedia=" + hasLocalMedia()
                + ", mediaEvidenceReference=" + mediaEvidenceReference + "}";
    }
}
