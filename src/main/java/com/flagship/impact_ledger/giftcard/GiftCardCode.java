package com.flagship.impact_ledger.giftcard;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A one-time code sold at a physical store.
 *
 * Redeemed exactly once; an invalidated code is redeemed with no redeemer.
 */
@Value
public class GiftCardCode {
    UUID id;
    String code;
    UUID skuId;
    boolean redeemed;
    UUID redeemedBy;
    Instant redeemedAt;
    Instant createdAt;

    public boolean isInvalidated() {
        return redeemed && redeemedBy == null;
    }
}
