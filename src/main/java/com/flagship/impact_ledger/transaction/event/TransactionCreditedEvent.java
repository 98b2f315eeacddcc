package com.flagship.impact_ledger.transaction.event;

import com.flagship.impact_ledger.transaction.ImpactTransaction;
import com.flagship.impact_ledger.transaction.PaymentStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a transaction's impact reaches the holder's wallet: at creation for
 * claims, gift cards, allocations and manual entries, on completion for purchases.
 * Certificate and email services start from this event.
 * {@code userNewlyConnected} is true only on the credit that first set the user's connect flag.
 */
@Value
public class TransactionCreditedEvent implements LedgerEvent {
    UUID eventId;
    UUID transactionId;
    UUID userId;
    UUID merchantId;
    UUID partnerId;
    UUID skuId;
    BigDecimal amount;
    BigDecimal impact;
    PaymentStatus paymentStatus;
    boolean connectFlag;
    boolean userNewlyConnected;
    boolean manual;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransactionCredited";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransactionCreditedEvent fromTransaction(ImpactTransaction transaction, boolean userNewlyConnected) {
        return new TransactionCreditedEvent(
            UUID.randomUUID(),
            transaction.getId(),
            transaction.getUserId(),
            transaction.getMerchantId(),
            transaction.getPartnerId(),
            transaction.getSkuId(),
            transaction.getAmount(),
            transaction.getCalculatedImpact(),
            transaction.getPaymentStatus(),
            transaction.isConnectFlag(),
            userNewlyConnected,
            transaction.isManual(),
            Instant.now()
        );
    }
}
