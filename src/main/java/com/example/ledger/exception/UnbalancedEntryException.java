package com.example.ledger.exception;

/** Raised when a journal entry's debits and credits differ by more than the tolerance. */
public class UnbalancedEntryException extends LedgerException {

    public UnbalancedEntryException(String message) {
        super(ErrorKind.UNBALANCED_ENTRY, message);
    }
}
