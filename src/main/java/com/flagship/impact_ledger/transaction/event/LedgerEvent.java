package com.flagship.impact_ledger.transaction.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger fact published through the outbox.
 * Consumers deduplicate on {@link #getEventId()}.
 */
public interface LedgerEvent {

    UUID getEventId();

    UUID getTransactionId();

    Instant getOccurredAt();

    String getEventType();
}
