package com.insurance.claims.domain.valueobject;

import java.util.Locale;

/**
 * Classification returned by the Decision Service for a submitted claim.
 */
public enum DecisionStatus {

    INSTANT_APPROVED("instant_approved"),
    UNDER_REVIEW("under_review"),
    REJECTED("rejected"),
    FLAGGED("flagged");

    private final String wireValue;

    DecisionStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    /**
     * Resolves the snake_case value used by the Decision Service API.
     *
     * @param value wire value, case-insensitive
     * @return matching status
     * @throws IllegalArgumentException if the value is unknown
     */
    public static DecisionStatus fromWireValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (DecisionStatus status : values()) {
                if (status.wireValue.equals(normalized)) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown decision status: " + value);
    }

    /**
     * Rejected and flagged claims end the same way for the submitter.
     *
     * @return true if REJECTED or FLAGGED
     */
    public boolean isNegative() {
        return this == REJECTED || this == FLAGGED;
    }
}
