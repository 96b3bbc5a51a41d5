package com.example.ledger.exception;

/** Unreadable import payload, e.g. an empty or header-only bank statement. */
public class InvalidFormatException extends LedgerException {

    public InvalidFormatException(String message) {
        super(ErrorKind.INVALID_FORMAT, message);
    }
}
