package com.insurance.claims.domain.valueobject;

import java.util.Optional;

/**
 * Outcome of the submission gate: pass, or the first failed check.
 */
public final class ValidationResult {

    private static final ValidationResult PASSED = new ValidationResult(null);

    private final ValidationFailureReason reason;

    private ValidationResult(ValidationFailureReason reason) {
        this.reason = reason;
    }

    public static ValidationResult passed() {
        return PASSED;
    }

    public static ValidationResult failed(ValidationFailureReason reason) {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        return new ValidationResult(reason);
    }

    public boolean isPassed() {
        return reason == null;
    }

    public Optional<ValidationFailureReason> getReason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public String toString() {
        return isPassed() ? "ValidationResult{passed}" : "ValidationResult{failed=" + reason + "}";
    }
}
