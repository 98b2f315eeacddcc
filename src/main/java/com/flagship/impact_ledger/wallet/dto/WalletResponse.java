package com.flagship.impact_ledger.wallet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.impact_ledger.wallet.Wallet;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class WalletResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("merchant_id")
    UUID merchantId;

    @JsonProperty("total_accumulated")
    BigDecimal totalAccumulated;

    @JsonProperty("total_redeemed")
    BigDecimal totalRedeemed;

    @JsonProperty("current_balance")
    BigDecimal currentBalance;

    @JsonProperty("total_amount_spent")
    BigDecimal totalAmountSpent;

    @JsonProperty("certified_asset_status")
    boolean certifiedAssetStatus;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static WalletResponse from(Wallet wallet) {
        return WalletResponse.builder()
            .id(wallet.getId())
            .userId(wallet.getUserId())
            .merchantId(wallet.getMerchantId())
            .totalAccumulated(wallet.getTotalAccumulated())
            .totalRedeemed(wallet.getTotalRedeemed())
            .currentBalance(wallet.getCurrentBalance())
            .totalAmountSpent(wallet.getTotalAmountSpent())
            .certifiedAssetStatus(wallet.isCertifiedAssetStatus())
            .updatedAt(wallet.getUpdatedAt())
            .build();
    }
}
