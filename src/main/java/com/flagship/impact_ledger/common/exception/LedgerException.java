package com.flagship.impact_ledger.common.exception;

/**
 * Base exception for all ledger failures.
 * Unchecked so that any failure inside a {@code @Transactional} unit rolls it back.
 */
public abstract class LedgerException extends RuntimeException {

    private final ErrorKind kind;

    protected LedgerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected LedgerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
