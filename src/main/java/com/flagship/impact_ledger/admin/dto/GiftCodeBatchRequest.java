package com.flagship.impact_ledger.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Either explicit {@code codes} or a {@code quantity} to generate.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GiftCodeBatchRequest {

    @NotNull(message = "SKU ID is required")
    @JsonProperty("sku_id")
    private UUID skuId;

    @JsonProperty("codes")
    private List<String> codes;

    @JsonProperty("quantity")
    private Integer quantity;
}
