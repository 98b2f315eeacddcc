package com.flagship.impact_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Body of {@code POST /api/transactions}. Either {@code sku_id} or {@code sku_code} is required.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTransactionRequest {

    @NotNull(message = "User ID is required")
    @JsonProperty("user_id")
    private UUID userId;

    @JsonProperty("sku_id")
    private UUID skuId;

    @Size(max = 100, message = "SKU code is too long")
    @JsonProperty("sku_code")
    private String skuCode;

    @DecimalMin(value = "0.00", message = "Amount cannot be negative")
    @JsonProperty("amount")
    private BigDecimal amount;

    @JsonProperty("merchant_id")
    private UUID merchantId;

    @JsonProperty("partner_id")
    private UUID partnerId;

    @Size(max = 255, message = "Order ID is too long")
    @JsonProperty("order_id")
    private String orderId;

    @JsonProperty("gift_code")
    private String giftCode;
}
