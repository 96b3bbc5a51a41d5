package com.example.ledger.exception;

/** A referenced account, document, period or bank row does not exist in the organization. */
public class NotFoundException extends LedgerException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
