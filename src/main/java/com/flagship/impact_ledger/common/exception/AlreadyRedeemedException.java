package com.flagship.impact_ledger.common.exception;

/**
 * Thrown when a gift card code has already been consumed.
 */
public class AlreadyRedeemedException extends LedgerException {

    public AlreadyRedeemedException(String code) {
        super(ErrorKind.ALREADY_REDEEMED, "Gift card code has already been redeemed: " + mask(code));
    }

    // codes are secrets, never echo them in full
    private static String mask(String code) {
        if (code == null || code.length() <= 4) {
            return "****";
        }
        return "****" + code.substring(code.length() - 4);
    }
}
