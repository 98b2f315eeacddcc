package com.flagship.impact_ledger.catalog;

import com.flagship.impact_ledger.transaction.PaymentStatus;

/**
 * How a SKU's impact is acquired.
 *
 * All modes share one impact formula; they differ only in where the amount comes from,
 * whether a gift code is consumed, and when the wallet is credited.
 */
public enum AcquisitionMode {

    /** Free claim of a lot the merchant already paid for. */
    CLAIM(true, false, true),

    /** Paid purchase of the SKU at its price, confirmed later by the payment processor. */
    PAY(true, false, false),

    /** Redemption of a one-time code sold at a physical store. */
    GIFT_CARD(true, true, true),

    /** Amount allocated by a partner at its own checkout. */
    ALLOCATION(false, false, true);

    private final boolean usesSkuPrice;
    private final boolean requiresGiftCode;
    private final boolean creditsOnCreation;

    AcquisitionMode(boolean usesSkuPrice, boolean requiresGiftCode, boolean creditsOnCreation) {
        this.usesSkuPrice = usesSkuPrice;
        this.requiresGiftCode = requiresGiftCode;
        this.creditsOnCreation = creditsOnCreation;
    }

    /**
     * True when the transaction amount is always the SKU price, whatever the caller sent.
     */
    public boolean usesSkuPrice() {
        return usesSkuPrice;
    }

    /**
     * True when a payment processor settles the amount, so a zero amount makes no sense.
     */
    public boolean involvesPayment() {
        return this == PAY || this == ALLOCATION;
    }

    public boolean requiresGiftCode() {
        return requiresGiftCode;
    }

    /**
     * True when the wallet is credited in the creating unit of work.
     * PAY defers the credit until the processor confirms the payment.
     */
    public boolean creditsOnCreation() {
        return creditsOnCreation;
    }

    /**
     * Status a new transaction of this mode starts in.
     * Modes with no payment processor involved never leave {@code n/a}.
     */
    public PaymentStatus initialPaymentStatus() {
        return involvesPayment() ? PaymentStatus.PENDING : PaymentStatus.NOT_APPLICABLE;
    }
}
