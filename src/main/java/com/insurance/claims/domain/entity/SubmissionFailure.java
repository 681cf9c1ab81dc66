package com.insurance.claims.domain.entity;

import com.insurance.claims.domain.valueobject.FailureStage;

/**
 * Why an attempt ended in FAILED: the stage that failed, the technical cause,
 * and the message shown to the submitter.
 *
 * @param stage   failing pipeline stage
 * @param cause   underlying error description, for logs and operators
 * @param message user-facing text
 */
public record SubmissionFailure(FailureStage stage, String cause, String message) {

    public SubmissionFailure {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }
}
