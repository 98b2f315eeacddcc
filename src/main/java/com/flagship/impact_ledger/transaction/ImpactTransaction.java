package com.flagship.impact_ledger.transaction;

import com.flagship.impact_ledger.common.exception.InvalidTransitionException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A recorded monetary-to-impact conversion.
 *
 * Amount, impact and rate are fixed when the transaction is created. Only the payment
 * status, the processor reference (bound once) and the wallet-credited flag change later,
 * and only through {@link PaymentStatusService}.
 */
@Value
@Builder(toBuilder = true)
public class ImpactTransaction {
    UUID id;
    UUID userId;
    UUID skuId;
    UUID merchantId;
    UUID partnerId;
    String orderId;
    BigDecimal amount;
    BigDecimal calculatedImpact;
    BigDecimal rateApplied;
    PaymentStatus paymentStatus;
    String processorReference;
    UUID giftCardCodeId;
    boolean connectFlag;
    boolean walletCredited;
    boolean manual;
    String justification;
    String createdBy;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Decides what a processor event asking for {@code target} means for this transaction.
     *
     * @return true if the transition must be applied, false if the transaction is already
     *         in {@code target} (a replayed event)
     * @throws InvalidTransitionException if the transaction is in a different terminal state
     */
    public boolean requiresTransitionTo(PaymentStatus target) {
        if (paymentStatus == target) {
            return false;
        }
        if (!paymentStatus.canTransitionTo(target)) {
            throw new InvalidTransitionException(id, paymentStatus.getWireValue(), target.getWireValue());
        }
        return true;
    }

    public boolean isPending() {
        return paymentStatus == PaymentStatus.PENDING;
    }
}
