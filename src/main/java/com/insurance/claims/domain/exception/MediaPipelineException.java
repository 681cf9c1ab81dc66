package com.insurance.claims.domain.exception;

import com.insurance.claims.domain.valueobject.FailureStage;

/**
 * Compression or upload of the evidence media failed. Terminal for the attempt.
 */
public class MediaPipelineException extends ClaimSubmissionException {

    private final FailureStage stage;

    public MediaPipelineException(FailureStage stage, String message, Throwable cause) {
        super(message, cause);
        if (stage == null || !stage.isMediaStage()) {
            throw new IllegalArgumentException("stage must be a media stage, got: " + stage);
        }
        this.stage = stage;
    }

    public MediaPipelineException(FailureStage stage, String message) {
        this(stage, message, null);
    }

    public FailureStage getStage() {
        return stage;
    }
}
