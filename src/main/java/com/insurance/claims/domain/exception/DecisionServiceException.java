package com.insurance.claims.domain.exception;

/**
 * The Decision Service call failed (network, timeout, server error or an
 * unreadable response). Distinct from a rejected claim, which is a successful
 * call with a negative result.
 */
public class DecisionServiceException extends ClaimSubmissionException {

    private final Integer httpStatus;

    public DecisionServiceException(String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = null;
    }

    public DecisionServiceException(String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    public DecisionServiceException(String message) {
        this(message, null);
    }

    /** @return HTTP status of the failed call, or null when no response was received */
    public Integer getHttpStatus() {
        return httpStatus;
    }
}
