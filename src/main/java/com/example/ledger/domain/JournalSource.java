package com.example.ledger.domain;

/**
 * The business event a journal entry records. Together with the source id this identifies the
 * event, and at most one entry exists per (source, sourceId) within an organization.
 */
public enum JournalSource {
    MANUAL,
    ORDER,
    COGS,
    REFUND,
    CASH_MOVEMENT,
    VENDOR_BILL,
    VENDOR_BILL_VOID,
    VENDOR_PAYMENT,
    VENDOR_CREDIT_NOTE,
    VENDOR_CREDIT_NOTE_VOID,
    VENDOR_CREDIT_REFUND,
    CUSTOMER_INVOICE,
    CUSTOMER_INVOICE_VOID,
    CUSTOMER_RECEIPT,
    CUSTOMER_CREDIT_NOTE,
    CUSTOMER_CREDIT_NOTE_VOID,
    CUSTOMER_CREDIT_REFUND,
    REVERSAL
}
