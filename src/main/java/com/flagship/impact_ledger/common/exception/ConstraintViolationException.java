package com.flagship.impact_ledger.common.exception;

/**
 * Thrown when a write collides with a unique key (SKU code, gift code, processor reference).
 */
public class ConstraintViolationException extends LedgerException {

    public ConstraintViolationException(String message) {
        super(ErrorKind.CONSTRAINT_VIOLATION, message);
    }

    public ConstraintViolationException(String message, Throwable cause) {
        super(ErrorKind.CONSTRAINT_VIOLATION, message, cause);
    }
}
