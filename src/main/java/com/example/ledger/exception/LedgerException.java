package com.example.ledger.exception;

/**
 * Base type for every failure raised by the ledger services. All subclasses are unchecked so a
 * failure anywhere inside a {@code @Transactional} service method rolls the whole unit back.
 */
public abstract class LedgerException extends RuntimeException {

    private final ErrorKind kind;

    protected LedgerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
