package com.example.ledger.exception;

/** The caller lacks the capability required for a privileged operation. */
public class ForbiddenException extends LedgerException {

    public ForbiddenException(String message) {
        super(ErrorKind.FORBIDDEN, message);
    }
}
