package com.example.ledger.domain;

/** How money moved. Each method maps to a cash or bank account per organization. */
public enum PaymentMethod {
    CASH,
    CARD,
    MOMO,
    BANK_TRANSFER
}
