package com.insurance.claims.domain.valueobject;

/**
 * Why the submission gate refused a claim. Each reason carries the corrective
 * message shown to the submitter verbatim.
 */
public enum ValidationFailureReason {

    AMOUNT_INVALID("estimatedAmount", "Please enter a valid claim amount"),
    DATE_INVALID("incidentDate", "Incident date cannot be in the future"),
    RATE_LIMITED("actorId", "Please wait before submitting another claim");

    private final String field;
    private final String message;

    ValidationFailureReason(String field, String message) {
        this.field = field;
        this.message = message;
    }

    /** @return the claim field the submitter has to correct */
    public String getField() {
        return field;
    }

    public String getMessage() {
        return message;
    }
}
