package com.example.ledger.exception;

/** Illegal lifecycle transition, e.g. posting an entry that is not DRAFT. */
public class InvalidStateException extends LedgerException {

    public InvalidStateException(String message) {
        super(ErrorKind.INVALID_STATE, message);
    }
}
