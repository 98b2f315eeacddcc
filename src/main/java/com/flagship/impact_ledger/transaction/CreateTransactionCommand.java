package com.flagship.impact_ledger.transaction;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Input to {@link TransactionManager#createTransaction}.
 *
 * The SKU is given by id or by code; the id wins when both are set.
 * {@code amount} is ignored for CLAIM and GIFT_CARD SKUs.
 */
@Value
@Builder
public class CreateTransactionCommand {
    UUID holderId;
    UUID skuId;
    String skuCode;
    BigDecimal amount;
    UUID merchantId;
    UUID partnerId;
    String orderId;
    String giftCode;
    String idempotencyKey;
}
