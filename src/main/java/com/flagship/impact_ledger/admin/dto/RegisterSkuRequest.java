package com.flagship.impact_ledger.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.impact_ledger.catalog.AcquisitionMode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterSkuRequest {

    @NotBlank(message = "Code is required")
    @JsonProperty("code")
    private String code;

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    private String name;

    @NotNull(message = "Price is required")
    @JsonProperty("price")
    private BigDecimal price;

    @NotNull(message = "Acquisition mode is required")
    @JsonProperty("acquisition_mode")
    private AcquisitionMode acquisitionMode;

    @JsonProperty("impact_multiplier")
    private BigDecimal impactMultiplier;

    @JsonProperty("connect_threshold")
    private BigDecimal connectThreshold;
}
