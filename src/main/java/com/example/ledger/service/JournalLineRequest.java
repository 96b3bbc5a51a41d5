package com.example.ledger.service;

import java.math.BigDecimal;

/**
 * One requested journal line. Exactly one of {@code debit} / {@code credit} must be positive.
 */
public record JournalLineRequest(Long accountId, Long branchId, BigDecimal debit, BigDecimal credit,
                                 String memo) {

    public static JournalLineRequest debit(Long accountId, BigDecimal amount) {
        return new JournalLineRequest(accountId, null, amount, BigDecimal.ZERO, null);
    }

    public static JournalLineRequest credit(Long accountId, BigDecimal amount) {
        return new JournalLineRequest(accountId, null, BigDecimal.ZERO, amount, null);
    }

    public JournalLineRequest withBranch(Long branch) {
        return new JournalLineRequest(accountId, branch, debit, credit, memo);
    }

    public JournalLineRequest withMemo(String text) {
        return new JournalLineRequest(accountId, branchId, debit, credit, text);
    }
}
