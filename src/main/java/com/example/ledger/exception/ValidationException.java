package com.example.ledger.exception;

/** Malformed input, such as a non-positive amount or a missing required field. */
public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
