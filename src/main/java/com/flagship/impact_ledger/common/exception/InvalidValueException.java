package com.flagship.impact_ledger.common.exception;

/**
 * Thrown for out-of-range numeric input: non-positive rates and amounts,
 * negative multipliers, debits beyond the available balance.
 */
public class InvalidValueException extends LedgerException {

    public InvalidValueException(String message) {
        super(ErrorKind.INVALID_VALUE, message);
    }
}
