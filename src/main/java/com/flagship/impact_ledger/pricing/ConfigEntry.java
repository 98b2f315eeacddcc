package com.flagship.impact_ledger.pricing;

import lombok.Value;

import java.time.Instant;

@Value
public class ConfigEntry {
    String key;
    String value;
    String description;
    long version;
    Instant updatedAt;
}
