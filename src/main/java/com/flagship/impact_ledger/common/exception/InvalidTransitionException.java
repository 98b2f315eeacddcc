package com.flagship.impact_ledger.common.exception;

/**
 * Thrown when a payment status transition is not allowed from the current state.
 */
public class InvalidTransitionException extends LedgerException {

    public InvalidTransitionException(Object transactionId, Object currentStatus, Object targetStatus) {
        super(ErrorKind.INVALID_TRANSITION, String.format(
            "Cannot transition transaction %s from %s to %s", transactionId, currentStatus, targetStatus));
    }

    public InvalidTransitionException(String message) {
        super(ErrorKind.INVALID_TRANSITION, message);
    }
}
