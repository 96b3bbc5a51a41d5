package com.example.ledger.exception;

import java.math.BigDecimal;

/** A payment, allocation or refund exceeds the outstanding or remaining balance. */
public class InsufficientBalanceException extends LedgerException {

    private final BigDecimal requested;
    private final BigDecimal available;

    public InsufficientBalanceException(String what, BigDecimal requested, BigDecimal available) {
        super(ErrorKind.INSUFFICIENT_BALANCE,
            "Amount " + requested.toPlainString() + " exceeds " + what + " "
                + available.toPlainString());
        this.requested = requested;
        this.available = available;
    }

    public BigDecimal getRequested() {
        return requested;
    }

    public BigDecimal getAvailable() {
        return available;
    }
}
