package com.flagship.impact_ledger.wallet;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only record of an out-of-band wallet correction.
 * {@code transactionId} is set when the correction reverses a transaction credit.
 */
@Value
public class WalletAdjustment {
    UUID id;
    UUID walletId;
    BigDecimal impactDelta;
    BigDecimal amountDelta;
    String reason;
    String adjustedBy;
    UUID transactionId;
    Instant adjustedAt;
}
