package com.flagship.impact_ledger.pricing;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One row of the append-only configuration audit trail.
 * {@code oldValue} is null for the first write of a key.
 */
@Value
public class ConfigAuditEntry {
    UUID id;
    String key;
    String oldValue;
    String newValue;
    String changedBy;
    Instant changedAt;
}
