package com.insurance.claims.domain.entity;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Payout terms of an instantly approved claim. Immutable.
 * <p>
 * Amounts compare by numeric value, so {@code 1200.00} equals {@code 1200}.
 * </p>
 */
public final class ApprovalResult {

    private final BigDecimal amount;
    private final long processingTimeMillis;

    public ApprovalResult(BigDecimal amount, long processingTimeMillis) {
        if (amount == null) {
            throw new IllegalArgumentException("amount cannot be null");
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be >= 0, got: " + amount);
        }
        if (processingTimeMillis < 0) {
            throw new IllegalArgumentException(
                    "processingTimeMillis must be >= 0, got: " + processingTimeMillis);
        }
        this.amount = amount;
        this.processingTimeMillis = processingTimeMillis;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public long getProcessingTimeMillis() {
        return processingTimeMillis;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        ApprovalResult that = (ApprovalResult) o;
        return processingTimeMillis == that.processingTimeMillis
                && amount.compareTo(that.amount) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount.stripTrailingZeros(), processingTimeMillis);
    }

    @Override
    public String toString() {
        return "ApprovalResult{amount=" + amount.toPlainString()
                + ", processingTimeMillis=" + processingTimeMillis + "}";
    }
}
