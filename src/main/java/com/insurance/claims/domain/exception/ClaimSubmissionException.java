package com.insurance.claims.domain.exception;

/**
 * Root of the failures raised by the claim submission pipeline.
 */
public abstract class ClaimSubmissionException extends RuntimeException {

    protected ClaimSubmissionException(String message) {
        super(message);
    }

    protected ClaimSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
