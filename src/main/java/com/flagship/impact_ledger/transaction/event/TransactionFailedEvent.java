package com.flagship.impact_ledger.transaction.event;

import com.flagship.impact_ledger.transaction.ImpactTransaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when the processor reports a payment as failed or canceled.
 * {@code reversedImpact} is zero unless a credit made at creation was taken back.
 * {@code unreversedImpact} is the part of that credit the user had already redeemed and
 * which needs manual correction; zero when the reversal was complete.
 */
@Value
public class TransactionFailedEvent implements LedgerEvent {
    UUID eventId;
    UUID transactionId;
    UUID userId;
    UUID skuId;
    String processorReference;
    BigDecimal amount;
    BigDecimal reversedImpact;
    BigDecimal unreversedImpact;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransactionFailed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransactionFailedEvent fromTransaction(ImpactTransaction transaction, BigDecimal reversedImpact,
                                                         BigDecimal unreversedImpact) {
        return new TransactionFailedEvent(
            UUID.randomUUID(),
            transaction.getId(),
            transaction.getUserId(),
            transaction.getSkuId(),
            transaction.getProcessorReference(),
            transaction.getAmount(),
            reversedImpact,
            unreversedImpact,
            Instant.now()
        );
    }
}
