package com.flagship.impact_ledger.transaction;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Input to {@link TransactionManager#createManualTransaction}: an administrator records
 * a transaction that happened outside the normal flows.
 */
@Value
@Builder
public class ManualTransactionCommand {
    UUID holderId;
    String skuCode;
    BigDecimal amount;
    UUID merchantId;
    UUID partnerId;
    String orderId;
    String justification;
    String actor;
}
