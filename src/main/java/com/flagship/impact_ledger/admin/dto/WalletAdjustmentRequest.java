package com.flagship.impact_ledger.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.impact_ledger.wallet.HolderType;
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
public class WalletAdjustmentRequest {

    /** USER when omitted. */
    @JsonProperty("holder_type")
    private HolderType holderType;

    @NotNull(message = "Holder ID is required")
    @JsonProperty("holder_id")
    private UUID holderId;

    @NotNull(message = "Impact delta is required")
    @JsonProperty("impact_delta")
    private BigDecimal impactDelta;

    @JsonProperty("amount_delta")
    private BigDecimal amountDelta;

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    private String reason;

    @NotBlank(message = "Actor is required")
    @JsonProperty("actor")
    private String actor;
}
