package com.example.ledger.domain;

/** Default payment terms for a vendor or customer; used to default a document's due date. */
public enum PaymentTerms {
    NET7(7),
    NET14(14),
    NET30(30);

    private final int days;

    PaymentTerms(int days) {
        this.days = days;
    }

    public int getDays() {
        return days;
    }
}
