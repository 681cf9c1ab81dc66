package com.insurance.claims.domain.valueobject;

import java.time.Duration;

/**
 * Tunables of the submission pipeline.
 *
 * @param maxMediaBytes     size budget of compressed evidence media
 * @param uploadDestination object-storage destination of evidence uploads
 * @param maxVideoDuration  longest recording the capture stage may produce;
 *                          enforced upstream, bounds what a local media
 *                          reference can point to
 * @param attemptRetention  how long a finished attempt stays readable as the
 *                          actor's current attempt before it is evicted
 */
public record SubmissionSettings(long maxMediaBytes, String uploadDestination, Duration maxVideoDuration,
        Duration attemptRetention) {

    public static final long DEFAULT_MAX_MEDIA_BYTES = 100L * 1024 * 1024;
    public static final Duration DEFAULT_MAX_VIDEO_DURATION = Duration.ofSeconds(120);
    public static final Duration DEFAULT_ATTEMPT_RETENTION = Duration.ofMinutes(15);

    public SubmissionSettings {
        if (maxMediaBytes <= 0) {
            throw new IllegalArgumentException("maxMediaBytes must be > 0, got: " + maxMediaBytes);
        }
        if (uploadDestination == null || uploadDestination.isBlank()) {
            throw new IllegalArgumentException("uploadDestination cannot be null or blank");
        }
        if (maxVideoDuration == null || maxVideoDuration.isNegative() || maxVideoDuration.isZero()) {
            throw new IllegalArgumentException("maxVideoDuration must be positive, got: " + maxVideoDuration);
        }
        if (attemptRetention == null || attemptRetention.isNegative()) {
            throw new IllegalArgumentException("attemptRetention must be >= 0, got: " + attemptRetention);
        }
    }

    public static SubmissionSettings defaults(String uploadDestination) {
        return new SubmissionSettings(DEFAULT_MAX_MEDIA_BYTES, uploadDestination, DEFAULT_MAX_VIDEO_DURATION,
                DEFAULT_ATTEMPT_RETENTION);
    }
}
