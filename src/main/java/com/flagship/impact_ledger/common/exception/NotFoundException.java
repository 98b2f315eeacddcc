package com.flagship.impact_ledger.common.exception;

/**
 * Thrown when a SKU, gift code, transaction or holder does not exist.
 */
public class NotFoundException extends LedgerException {

    public NotFoundException(String entity, Object key) {
        super(ErrorKind.NOT_FOUND, String.format("%s not found: %s", entity, key));
    }
}
