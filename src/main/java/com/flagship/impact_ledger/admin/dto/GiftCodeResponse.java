package com.flagship.impact_ledger.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.impact_ledger.giftcard.GiftCardCode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class GiftCodeResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("code")
    String code;

    @JsonProperty("sku_id")
    UUID skuId;

    @JsonProperty("is_redeemed")
    boolean redeemed;

    @JsonProperty("invalidated")
    boolean invalidated;

    @JsonProperty("redeemed_by")
    UUID redeemedBy;

    @JsonProperty("redeemed_at")
    Instant redeemedAt;

    @JsonProperty("created_at")
    Instant createdAt;

    public static GiftCodeResponse from(GiftCardCode code) {
        return GiftCodeResponse.builder()
            .id(code.getId())
            .code(code.getCode())
            .skuId(code.getSkuId())
            .redeemed(code.isRedeemed())
            .invalidated(code.isInvalidated())
            .redeemedBy(code.getRedeemedBy())
            .redeemedAt(code.getRedeemedAt())
            .createdAt(code.getCreatedAt())
            .build();
    }
}
