package com.flagship.impact_ledger.wallet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.impact_ledger.wallet.WalletAdjustment;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AdjustmentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("wallet_id")
    UUID walletId;

    @JsonProperty("impact_delta")
    BigDecimal impactDelta;

    @JsonProperty("amount_delta")
    BigDecimal amountDelta;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("adjusted_by")
    String adjustedBy;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("adjusted_at")
    Instant adjustedAt;

    public static AdjustmentResponse from(WalletAdjustment adjustment) {
        return AdjustmentResponse.builder()
            .id(adjustment.getId())
            .walletId(adjustment.getWalletId())
            .impactDelta(adjustment.getImpactDelta())
            .amountDelta(adjustment.getAmountDelta())
            .reason(adjustment.getReason())
            .adjustedBy(adjustment.getAdjustedBy())
            .transactionId(adjustment.getTransactionId())
            .adjustedAt(adjustment.getAdjustedAt())
            .build();
    }
}
