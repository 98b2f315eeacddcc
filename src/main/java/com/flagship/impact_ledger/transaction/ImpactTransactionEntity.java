package com.flagship.impact_ledger.transaction;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for {@code impact_transactions}.
 *
 * No setters. After the insert the row only changes through the conditional JPQL updates
 * in {@link ImpactTransactionRepository}; a database trigger rejects any change to
 * amount, impact, rate, holder or SKU.
 */
@Entity
@Table(
    name = "impact_transactions",
    indexes = {
        @Index(name = "idx_impact_transactions_user", columnList = "user_id"),
        @Index(name = "idx_impact_transactions_status", columnList = "payment_status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ImpactTransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "sku_id", nullable = false, updatable = false)
    private UUID skuId;

    @Column(name = "merchant_id", updatable = false)
    private UUID merchantId;

    @Column(name = "partner_id", updatable = false)
    private UUID partnerId;

    @Column(name = "order_id", updatable = false)
    private String orderId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "calculated_impact", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal calculatedImpact;

    @Column(name = "rate_applied", nullable = false, updatable = false, precision = 19, scale = 6)
    private BigDecimal rateApplied;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(name = "processor_reference", unique = true)
    private String processorReference;

    @Column(name = "gift_card_code_id", unique = true, updatable = false)
    private UUID giftCardCodeId;

    @Column(name = "connect_flag", nullable = false, updatable = false)
    private boolean connectFlag;

    @Column(name = "wallet_credited", nullable = false)
    private boolean walletCredited;

    @Column(nullable = false, updatable = false)
    private boolean manual;

    @Column(updatable = false)
    private String justification;

    @Column(name = "created_by", updatable = false)
    private String createdBy;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    /**
     * The idempotency key is a request concern, so it travels beside the domain object.
     */
    static ImpactTransactionEntity fromDomain(ImpactTransaction transaction, String idempotencyKey) {
        ImpactTransactionEntity entity = new ImpactTransactionEntity();
        entity.id = transaction.getId();
        entity.userId = transaction.getUserId();
        entity.skuId = transaction.getSkuId();
        entity.merchantId = transaction.getMerchantId();
        entity.partnerId = transaction.getPartnerId();
        entity.orderId = transaction.getOrderId();
        entity.amount = transaction.getAmount();
        entity.calculatedImpact = transaction.getCalculatedImpact();
        entity.rateApplied = transaction.getRateApplied();
        entity.paymentStatus = transaction.getPaymentStatus();
        entity.processorReference = transaction.getProcessorReference();
        entity.giftCardCodeId = transaction.getGiftCardCodeId();
        entity.connectFlag = transaction.isConnectFlag();
        entity.walletCredited = transaction.isWalletCredited();
        entity.manual = transaction.isManual();
        entity.justification = transaction.getJustification();
        entity.createdBy = transaction.getCreatedBy();
        entity.idempotencyKey = idempotencyKey;
        return entity;
    }

    public ImpactTransaction toDomain() {
        return ImpactTransaction.builder()
            .id(id)
            .userId(userId)
            .skuId(skuId)
            .merchantId(merchantId)
            .partnerId(partnerId)
            .orderId(orderId)
            .amount(amount)
            .calculatedImpact(calculatedImpact)
            .rateApplied(rateApplied)
            .paymentStatus(paymentStatus)
            .processorReference(processorReference)
            .giftCardCodeId(giftCardCodeId)
            .connectFlag(connectFlag)
            .walletCredited(walletCredited)
            .manual(manual)
            .justification(justification)
            .createdBy(createdBy)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }
}
