package com.example.ledger.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Money helpers shared by the ledger. All amounts are stored with two decimal places and compared
 * with a fixed tolerance of one minor unit.
 */
public final class Amounts {

    public static final BigDecimal TOLERANCE = new BigDecimal("0.01");
    public static final int SCALE = 2;

    private Amounts() {
    }

    public static BigDecimal normalize(BigDecimal amount) {
        return amount == null ? BigDecimal.ZERO.setScale(SCALE) : amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }

    /** True when the two sides differ by less than {@link #TOLERANCE}. */
    public static boolean isBalanced(BigDecimal debits, BigDecimal credits) {
        return debits.subtract(credits).abs().compareTo(TOLERANCE) < 0;
    }

    /** True when {@code amount} does not exceed {@code limit} by more than the tolerance. */
    public static boolean fitsWithin(BigDecimal amount, BigDecimal limit) {
        return amount.compareTo(limit.add(TOLERANCE)) <= 0;
    }
}
