package com.flagship.impact_ledger.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ManualTransactionRequest {

    @NotNull(message = "User ID is required")
    @JsonProperty("user_id")
    private UUID userId;

    @NotBlank(message = "SKU code is required")
    @JsonProperty("sku_code")
    private String skuCode;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    private BigDecimal amount;

    @JsonProperty("merchant_id")
    private UUID merchantId;

    @JsonProperty("partner_id")
    private UUID partnerId;

    @JsonProperty("order_id")
    private String orderId;

    @NotBlank(message = "Justification is required")
    @JsonProperty("justification")
    private String justification;

    @NotBlank(message = "Actor is required")
    @JsonProperty("actor")
    private String actor;
}
