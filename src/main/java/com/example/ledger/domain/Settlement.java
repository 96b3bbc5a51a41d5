package com.example.ledger.domain;

import java.math.BigDecimal;

/**
 * How much of a document has been settled. This is the single pure function behind bill,
 * invoice and credit note statuses: nothing used means untouched, at least
 * {@code total - tolerance} used means fully settled, anything between is partial.
 */
public enum Settlement {
    NONE,
    PARTIAL,
    FULL;

    public static Settlement of(BigDecimal used, BigDecimal total) {
        if (used == null || used.signum() <= 0) {
            return NONE;
        }
        if (used.compareTo(total.subtract(Amounts.TOLERANCE)) >= 0) {
            return FULL;
        }
        return PARTIAL;
    }
}
