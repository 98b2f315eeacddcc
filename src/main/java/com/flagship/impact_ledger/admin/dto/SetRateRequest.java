package com.flagship.impact_ledger.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Positivity of the rate is checked by the pricing oracle, so that a zero rate is
 * reported as an invalid value rather than a malformed request.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SetRateRequest {

    @NotNull(message = "Rate is required")
    @JsonProperty("rate")
    private BigDecimal rate;

    @NotBlank(message = "Actor is required")
    @JsonProperty("actor")
    private String actor;
}
