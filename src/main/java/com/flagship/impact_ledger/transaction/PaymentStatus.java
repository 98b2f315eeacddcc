package com.flagship.impact_ledger.transaction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Payment status of an impact transaction.
 *
 * <pre>
 *   PENDING --> COMPLETED
 *      \------> FAILED
 *   NOT_APPLICABLE (no processor involved, never transitions)
 * </pre>
 *
 * Stored by name; exchanged over the API as {@code pending}, {@code completed},
 * {@code failed} and {@code n/a}.
 */
public enum PaymentStatus {

    /** Awaiting confirmation from the payment processor. */
    PENDING("pending"),

    /** Confirmed by the processor. Terminal. */
    COMPLETED("completed"),

    /** Rejected or canceled by the processor. Terminal. */
    FAILED("failed"),

    /** Claims and gift card redemptions. Terminal from creation. */
    NOT_APPLICABLE("n/a");

    private final String wireValue;

    PaymentStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Whether a transition from this status to {@code target} is defined.
     * Staying in the same status is not a transition.
     */
    public boolean canTransitionTo(PaymentStatus target) {
        return this == PENDING && (target == COMPLETED || target == FAILED);
    }

    /**
     * Accepts the wire value or the enum name, in any case.
     *
     * @throws IllegalArgumentException for anything else
     */
    @JsonCreator
    public static PaymentStatus fromWireValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (PaymentStatus status : values()) {
                if (status.wireValue.equals(normalized) || status.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown payment status: " + value);
    }
}
