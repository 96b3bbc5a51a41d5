package com.example.ledger.exception;

/** A fiscal period date range overlaps an existing period, or a unique code is already taken. */
public class DuplicateOverlapException extends LedgerException {

    public DuplicateOverlapException(String message) {
        super(ErrorKind.DUPLICATE_OVERLAP, message);
    }
}
