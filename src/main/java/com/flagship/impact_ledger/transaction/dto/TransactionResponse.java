package com.flagship.impact_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.impact_ledger.transaction.ImpactTransaction;
import com.flagship.impact_ledger.transaction.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("sku_id")
    UUID skuId;

    @JsonProperty("merchant_id")
    UUID merchantId;

    @JsonProperty("partner_id")
    UUID partnerId;

    @JsonProperty("order_id")
    String orderId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("calculated_impact")
    BigDecimal calculatedImpact;

    @JsonProperty("rate_applied")
    BigDecimal rateApplied;

    @JsonProperty("payment_status")
    PaymentStatus paymentStatus;

    @JsonProperty("processor_reference")
    String processorReference;

    @JsonProperty("connect_flag")
    boolean connectFlag;

    @JsonProperty("wallet_credited")
    boolean walletCredited;

    @JsonProperty("manual")
    boolean manual;

    @JsonProperty("justification")
    String justification;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    /**
     * The gift card code id is left out: it would let a caller correlate codes.
     */
    public static TransactionResponse from(ImpactTransaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .userId(transaction.getUserId())
            .skuId(transaction.getSkuId())
            .merchantId(transaction.getMerchantId())
            .partnerId(transaction.getPartnerId())
            .orderId(transaction.getOrderId())
            .amount(transaction.getAmount())
            .calculatedImpact(transaction.getCalculatedImpact())
            .rateApplied(transaction.getRateApplied())
            .paymentStatus(transaction.getPaymentStatus())
            .processorReference(transaction.getProcessorReference())
            .connectFlag(transaction.isConnectFlag())
            .walletCredited(transaction.isWalletCredited())
            .manual(transaction.isManual())
            .justification(transaction.getJustification())
            .createdBy(transaction.getCreatedBy())
            .createdAt(transaction.getCreatedAt())
            .updatedAt(transaction.getUpdatedAt())
            .build();
    }
}
