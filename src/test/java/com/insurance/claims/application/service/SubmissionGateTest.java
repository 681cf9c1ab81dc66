package com.insurance.claims.application.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.insurance.claims.application.port.out.RateLimiter;
import com.insurance.claims.domain.entity.ClaimRequest;
import com.insurance.claims.domain.valueobject.ValidationFailureReason;
import com.insurance.claims.domain.valueobject.ValidationResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SubmissionGate Unit Tests")
class SubmissionGateTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private RateLimiter rateLimiter;

    private SubmissionGate gate;

    @BeforeEach
    void setUp() {
        gate = new SubmissionGate(rateLimiter, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private ClaimRequest draft(String amount, Instant incidentDate) {
        return new ClaimRequest("actor-1", amount != null ? new BigDecimal(amount) : null, incidentDate);
    }

    @Test
    @DisplayName("Should refuse a zero amount without asking the rate limiter")
    void shouldRefuseZeroAmount() {
        // When
        ValidationResult result = gate.validate(draft("0", NOW.minus(Duration.ofDays(1))));

        // Then
        assertThat(result.isPassed()).isFalse();
        assertThat(result.getReason()).contains(ValidationFailureReason.AMOUNT_INVALID);
        verify(rateLimiter, never()).isSubmittingTooFrequently(anyString());
    }

    @Test
    @DisplayName("Should refuse a missing amount")
    void shouldRefuseMissingAmount() {
        ValidationResult result = gate.validate(draft(null, NOW.minus(Duration.ofDays(1))));

        assertThat(result.getReason()).contains(ValidationFailureReason.AMOUNT_INVALID);
    }

    @Test
    @DisplayName("Should accept the smallest positive amount")
    void shouldAcceptOneCent() {
        // Given
        when(rateLimiter.isSubmittingTooFrequently("actor-1")).thenReturn(false);

        // When
        ValidationResult result = gate.validate(draft("0.01", NOW.minus(Duration.ofHours(2))));

        // Then
        assertThat(result.isPassed()).isTrue();
        assertThat(result.getReason()).isEmpty();
    }

    @Test
    @DisplayName("Should refuse an amount at the upper bound")
    void shouldRefuseAmountAtUpperBound() {
        ValidationResult result = gate.validate(draft("1000000", NOW.minus(Duration.ofDays(1))));

        assertThat(result.getReason()).contains(ValidationFailureReason.AMOUNT_INVALID);
        verify(rateLimiter, never()).isSubmittingTooFrequently(anyString());
    }

    @Test
    @DisplayName("Should accept an amount just below the upper bound")
    void shouldAcceptAmountBelowUpperBound() {
        when(rateLimiter.isSubmittingTooFrequently("actor-1")).thenReturn(false);

        ValidationResult result = gate.validate(draft("999999.99", NOW.minus(Duration.ofDays(1))));

        assertThat(result.isPassed()).isTrue();
    }

    @Test
    @DisplayName("Should refuse an incident date in the future")
    void shouldRefuseFutureDate() {
        ValidationResult result = gate.validate(draft("500", NOW.plus(Duration.ofDays(1))));

        assertThat(result.getReason()).contains(ValidationFailureReason.DATE_INVALID);
        assertThat(ValidationFailureReason.DATE_INVALID.getMessage())
                .isEqualTo("Incident date cannot be in the future");
        verify(rateLimiter, never()).isSubmittingTooFrequently(anyString());
    }

    @Test
    @DisplayName("Should refuse an incident date equal to now")
    void shouldRefuseDateEqualToNow() {
        ValidationResult result = gate.validate(draft("500", NOW));

        assertThat(result.getReason()).contains(ValidationFailureReason.DATE_INVALID);
    }

    @Test
    @DisplayName("Should report the amount before the date when both are invalid")
    void shouldCheckAmountFirst() {
        ValidationResult result = gate.validate(draft("-5", NOW.plus(Duration.ofDays(3))));

        assertThat(result.getReason()).contains(ValidationFailureReason.AMOUNT_INVALID);
    }

    @Test
    @DisplayName("Should refuse an actor the rate limiter reports")
    void shouldRefuseRateLimitedActor() {
        // Given
        when(rateLimiter.isSubmittingTooFrequently("actor-1")).thenReturn(true);

        // When
        ValidationResult result = gate.validate(draft("250", NOW.minus(Duration.ofDays(1))));

        // Then
        assertThat(result.getReason()).contains(ValidationFailureReason.RATE_LIMITED);
        assertThat(result.getReason().get().getMessage())
                .isEqualTo("Please wait before submitting another claim");
    }
}
