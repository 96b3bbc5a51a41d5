package com.example.ledger.exception;

/** A required GL account (AP, expense, cash...) is not configured for the organization. */
public class MissingAccountMappingException extends LedgerException {

    public MissingAccountMappingException(String message) {
        super(ErrorKind.MISSING_ACCOUNT_MAPPING, message);
    }
}
