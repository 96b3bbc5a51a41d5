package com.example.ledger.domain;

/**
 * Credit note lifecycle. Once OPEN, the status follows the used portion
 * ({@code allocatedAmount + refundedAmount}) the same way bill statuses follow paid amounts.
 */
public enum CreditNoteStatus {
    DRAFT,
    OPEN,
    PARTIALLY_APPLIED,
    APPLIED,
    VOID
}
