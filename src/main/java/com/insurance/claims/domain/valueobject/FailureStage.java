package com.insurance.claims.domain.valueobject;

/**
 * Pipeline stage a failed attempt is attributed to.
 */
public enum FailureStage {

    VALIDATION,
    MEDIA_COMPRESSION,
    MEDIA_UPLOAD,
    DECISION_SERVICE;

    /**
     * @return true for the two Media Pipeline sub-stages
     */
    public boolean isMediaStage() {
        return this == MEDIA_COMPRESSION || this == MEDIA_UPLOAD;
    }
}
