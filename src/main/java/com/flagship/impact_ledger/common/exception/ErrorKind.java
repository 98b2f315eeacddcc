package com.flagship.impact_ledger.common.exception;

/**
 * Error taxonomy of the ledger.
 *
 * A conflict means the request was well-formed but lost against the current
 * state of the ledger (a consumed gift code, a terminal transaction, a duplicate key).
 * Callers may re-read state before deciding what to do. Everything else is a
 * permanent input error and retrying the same request will fail the same way.
 */
public enum ErrorKind {
    NOT_FOUND(false),
    ALREADY_REDEEMED(true),
    INVALID_VALUE(false),
    INVALID_TRANSITION(true),
    VALIDATION_ERROR(false),
    CONSTRAINT_VIOLATION(true);

    private final boolean conflict;

    ErrorKind(boolean conflict) {
        this.conflict = conflict;
    }

    public boolean isConflict() {
        return conflict;
    }
}
