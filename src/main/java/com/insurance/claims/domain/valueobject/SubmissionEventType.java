package com.insurance.claims.domain.valueobject;

/**
 * Typed events emitted to the presentation layer.
 * <p>
 * The core never interprets these; haptics, confetti and push scheduling on the
 * client are derived from them.
 * </p>
 */
public enum SubmissionEventType {

    /** The attempt moved to a new state; carries the new snapshot */
    STATE_CHANGED("state-changed"),

    /** Instant approval completed */
    SUBMISSION_SUCCEEDED("submission-succeeded"),

    /** Instant approval completed, celebratory presentation requested */
    CELEBRATE("celebrate");

    private final String wireName;

    SubmissionEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
