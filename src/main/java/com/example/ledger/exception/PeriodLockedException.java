package com.example.ledger.exception;

import java.time.LocalDate;

/** A mutation was attempted against a date inside a LOCKED fiscal period. */
public class PeriodLockedException extends LedgerException {

    private final LocalDate date;
    private final String periodName;

    public PeriodLockedException(LocalDate date, String periodName, String status) {
        super(ErrorKind.PERIOD_LOCKED,
            "Fiscal period '" + periodName + "' is " + status + "; cannot post on " + date);
        this.date = date;
        this.periodName = periodName;
    }

    public LocalDate getDate() {
        return date;
    }

    public String getPeriodName() {
        return periodName;
    }
}
