package com.insurance.claims.domain.exception;

import com.insurance.claims.domain.valueobject.ValidationFailureReason;

/**
 * The submission gate refused the claim. Raised synchronously; the submitter
 * corrects the input and resubmits.
 */
public class ClaimValidationException extends ClaimSubmissionException {

    private final ValidationFailureReason reason;

    public ClaimValidationException(ValidationFailureReason reason) {
        super(reason.getMessage());
        this.reason = reason;
    }

    public ValidationFailureReason getReason() {
        return reason;
    }

    public String getField() {
        return reason.getField();
    }
}
