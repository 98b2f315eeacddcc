package com.flagship.impact_ledger.wallet;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot of a wallet row. Exactly one of {@code userId} and {@code merchantId} is set.
 */
@Value
public class Wallet {
    UUID id;
    UUID userId;
    UUID merchantId;
    BigDecimal totalAccumulated;
    BigDecimal totalRedeemed;
    BigDecimal currentBalance;
    BigDecimal totalAmountSpent;
    boolean certifiedAssetStatus;
    Instant createdAt;
    Instant updatedAt;

    public Holder getHolder() {
        return userId != null ? Holder.user(userId) : Holder.merchant(merchantId);
    }
}
