package com.example.ledger.exception;

/** Failure categories surfaced to callers of the ledger services. */
public enum ErrorKind {
    VALIDATION,
    INVALID_FORMAT,
    UNBALANCED_ENTRY,
    INVALID_STATE,
    PERIOD_LOCKED,
    NOT_FOUND,
    INSUFFICIENT_BALANCE,
    MISSING_ACCOUNT_MAPPING,
    DUPLICATE_OVERLAP,
    FORBIDDEN
}
