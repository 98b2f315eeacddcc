package com.flagship.impact_ledger.catalog;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Read-only view of a catalog SKU as the ledger sees it.
 */
@Value
public class Sku {
    UUID id;
    String code;
    String name;
    BigDecimal price;
    AcquisitionMode acquisitionMode;
    BigDecimal impactMultiplier;
    BigDecimal connectThreshold;
    boolean active;

    /**
     * A transaction reaching the threshold is flagged for downstream connect handling.
     */
    public boolean reachesConnectThreshold(BigDecimal amount) {
        return amount.compareTo(connectThreshold) >= 0;
    }
}
