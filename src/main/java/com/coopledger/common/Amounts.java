package com.coopledger.common;

import com.coopledger.common.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.Objects;

/**
 * Helpers for the cooperative's single-currency amounts.
 * Amounts are carried at two decimal places and compared with a one-cent tolerance.
 */
public final class Amounts {

    public static final int SCALE = 2;

    public static final BigDecimal TOLERANCE = new BigDecimal("0.01");

    private Amounts() {
    }

    public static BigDecimal of(String amount) {
        return normalize(new BigDecimal(amount));
    }

    /**
     * Null is treated as zero so optional components can be passed straight through.
     */
    public static BigDecimal normalize(BigDecimal amount) {
        if (amount == null) {
            return BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
        }
        return amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal sum(BigDecimal... amounts) {
        return Arrays.stream(amounts)
            .filter(Objects::nonNull)
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }

    /**
     * True when the two amounts differ by no more than one cent.
     */
    public static boolean matches(BigDecimal a, BigDecimal b) {
        return normalize(a).subtract(normalize(b)).abs().compareTo(TOLERANCE) <= 0;
    }

    public static BigDecimal requireNonNegative(BigDecimal amount, String field) {
        BigDecimal normalized = normalize(amount);
        if (normalized.signum() < 0) {
            throw new ValidationException(field + " cannot be negative: " + amount);
        }
        return normalized;
    }
}
