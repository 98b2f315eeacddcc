package com.flagship.impact_ledger.wallet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RedeemImpactRequest {

    @NotNull(message = "Impact is required")
    @DecimalMin(value = "0.01", message = "Impact must be greater than 0")
    @JsonProperty("impact")
    private BigDecimal impact;
}
