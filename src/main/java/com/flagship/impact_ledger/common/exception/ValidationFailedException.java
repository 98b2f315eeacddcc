package com.flagship.impact_ledger.common.exception;

/**
 * Thrown when a required field is missing or blank.
 */
public class ValidationFailedException extends LedgerException {

    public ValidationFailedException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }
}
