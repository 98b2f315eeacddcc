package com.flagship.impact_ledger.wallet;

import lombok.Value;

import java.util.UUID;

/**
 * A user or a merchant, identified by id. Owns at most one wallet.
 */
@Value
public class Holder {
    HolderType type;
    UUID id;

    public static Holder user(UUID userId) {
        return new Holder(HolderType.USER, userId);
    }

    public static Holder merchant(UUID merchantId) {
        return new Holder(HolderType.MERCHANT, merchantId);
    }

    @Override
    public String toString() {
        return type.name().toLowerCase() + ":" + id;
    }
}
