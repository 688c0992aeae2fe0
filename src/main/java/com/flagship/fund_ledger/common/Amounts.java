package com.flagship.fund_ledger.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Money helpers. Every amount in the system carries two decimal places.
 */
public final class Amounts {

    public static final int SCALE = 2;

    private Amounts() {
        // Utility class
    }

    public static BigDecimal normalize(BigDecimal amount) {
        return amount == null ? zero() : amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Normalizes an amount that must be strictly positive.
     *
     * @throws IllegalArgumentException if the amount is null, zero or negative
     */
    public static BigDecimal requirePositive(BigDecimal amount, String field) {
        if (amount == null || amount.compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalArgumentException(field + " must be positive");
        }
        return normalize(amount);
    }

    public static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    public static BigDecimal nonNegative(BigDecimal amount) {
        return amount.signum() < 0 ? zero() : normalize(amount);
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }
}
