package com.example.ledger.repository;

import java.math.BigDecimal;

/** Per-account debit and credit sums returned by the reporting queries. */
public interface AccountTotals {

    Long getAccountId();

    BigDecimal getDebits();

    BigDecimal getCredits();
}
