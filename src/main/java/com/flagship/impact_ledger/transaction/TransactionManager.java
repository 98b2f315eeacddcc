package com.flagship.impact_ledger.transaction;

import com.flagship.impact_ledger.catalog.AcquisitionMode;
import com.flagship.impact_ledger.catalog.CatalogService;
import com.flagship.impact_ledger.catalog.Sku;
import com.flagship.impact_ledger.common.exception.ConstraintViolationException;
import com.flagship.impact_ledger.common.exception.InvalidTransitionException;
import com.flagship.impact_ledger.common.exception.InvalidValueException;
import com.flagship.impact_ledger.common.exception.NotFoundException;
import com.flagship.impact_ledger.common.exception.ValidationFailedException;
import com.flagship.impact_ledger.giftcard.GiftCardService;
import com.flagship.impact_ledger.observability.CorrelationContext;
import com.flagship.impact_ledger.observability.LedgerMetrics;
import com.flagship.impact_ledger.outbox.OutboxService;
import com.flagship.impact_ledger.pricing.PricingOracle;
import com.flagship.impact_ledger.transaction.event.TransactionCreditedEvent;
import com.flagship.impact_ledger.wallet.Holder;
import com.flagship.impact_ledger.wallet.HolderService;
import com.flagship.impact_ledger.wallet.WalletLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Creates impact transactions.
 *
 * Each creation is one database transaction: SKU lookup, gift code consumption,
 * the transaction row, the wallet credit and the outbox event commit or roll back together.
 * Acquisition modes share this path; {@link AcquisitionMode} decides where the amount comes
 * from, whether a gift code is consumed and whether the credit happens now or on completion.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionManager {

    static final String AGGREGATE_TYPE = "ImpactTransaction";
    static final String MANUAL_ORDER_PREFIX = "MANUAL-";

    private final CatalogService catalogService;
    private final HolderService holderService;
    private final GiftCardService giftCardService;
    private final PricingOracle pricingOracle;
    private final ImpactCalculator impactCalculator;
    private final WalletLedger walletLedger;
    private final ImpactTransactionRepository repository;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;

    /**
     * @throws NotFoundException if the SKU is unknown or inactive, or a referenced party does not exist
     * @throws InvalidValueException if the amount does not suit the SKU's mode
     * @throws ValidationFailedException if a gift card SKU is used without a code
     * @throws com.flagship.impact_ledger.common.exception.AlreadyRedeemedException if the gift code was used before
     */
    @Transactional
    public ImpactTransaction createTransaction(CreateTransactionCommand command) {
        long startTime = System.currentTimeMillis();
        String mode = "unknown";

        try {
            if (command.getHolderId() == null) {
                throw new ValidationFailedException("Holder is required");
            }
            Sku sku = resolveSku(command);
            mode = sku.getAcquisitionMode().name();
            requireParties(command.getHolderId(), command.getMerchantId(), command.getPartnerId());

            AcquisitionMode acquisitionMode = sku.getAcquisitionMode();
            BigDecimal amount = resolveAmount(sku, command.getAmount());

            UUID giftCardCodeId = null;
            if (acquisitionMode.requiresGiftCode()) {
                if (command.getGiftCode() == null || command.getGiftCode().isBlank()) {
                    throw new ValidationFailedException("A gift card code is required for SKU " + sku.getCode());
                }
                giftCardCodeId = giftCardService.redeem(command.getGiftCode(), command.getHolderId(), sku.getId())
                        .getId();
                metrics.recordGiftCardRedemption("success");
            }

            BigDecimal rate = pricingOracle.getRate();
            ImpactTransaction transaction = ImpactTransaction.builder()
                    .id(UUID.randomUUID())
                    .userId(command.getHolderId())
                    .skuId(sku.getId())
                    .merchantId(command.getMerchantId())
                    .partnerId(command.getPartnerId())
                    .orderId(command.getOrderId())
                    .amount(amount)
                    .calculatedImpact(impactCalculator.calculate(amount, sku.getImpactMultiplier(), rate))
                    .rateApplied(rate)
                    .paymentStatus(acquisitionMode.initialPaymentStatus())
                    .giftCardCodeId(giftCardCodeId)
                    .connectFlag(sku.reachesConnectThreshold(amount))
                    .walletCredited(acquisitionMode.creditsOnCreation())
                    .manual(false)
                    .build();

            ImpactTransaction saved = persist(transaction, command.getIdempotencyKey());
            MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, saved.getId().toString());

            if (saved.isWalletCredited()) {
                creditWallets(saved);
            }

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordTransactionCreated(mode, saved.getPaymentStatus().name());
            metrics.recordLatency("create", duration);

            log.info("Transaction created: skuCode={}, mode={}, amount={}, impact={}, rate={}, status={}, " +
                            "credited={}, connect={}, duration={}ms",
                    sku.getCode(), mode, saved.getAmount(), saved.getCalculatedImpact(), rate,
                    saved.getPaymentStatus().getWireValue(), saved.isWalletCredited(), saved.isConnectFlag(),
                    duration);
            return saved;

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordTransactionCreated(mode, "error");
            metrics.recordLatency("create", duration);
            log.error("Transaction creation failed: mode={}, error={}, duration={}ms", mode, e.getMessage(), duration);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    /**
     * Records a transaction on an administrator's word. No gift code and no processor:
     * the transaction is completed and credited immediately, through the same impact
     * computation and wallet credit as every other transaction.
     */
    @Transactional
    public ImpactTransaction createManualTransaction(ManualTransactionCommand command) {
        if (command.getJustification() == null || command.getJustification().isBlank()) {
            throw new ValidationFailedException("A justification is required for manual transactions");
        }
        if (command.getActor() == null || command.getActor().isBlank()) {
            throw new ValidationFailedException("Actor is required for manual transactions");
        }
        if (command.getHolderId() == null) {
            throw new ValidationFailedException("Holder is required");
        }
        if (command.getAmount() == null) {
            throw new ValidationFailedException("Amount is required for manual transactions");
        }
        if (command.getAmount().signum() <= 0) {
            throw new InvalidValueException("Amount must be greater than zero: " + command.getAmount());
        }

        Sku sku = catalogService.getActiveByCode(command.getSkuCode());
        requireParties(command.getHolderId(), command.getMerchantId(), command.getPartnerId());

        BigDecimal amount = impactCalculator.normalizeAmount(command.getAmount());
        BigDecimal rate = pricingOracle.getRate();
        String orderId = command.getOrderId() != null && !command.getOrderId().isBlank()
                ? command.getOrderId()
                : MANUAL_ORDER_PREFIX + System.currentTimeMillis();

        ImpactTransaction transaction = ImpactTransaction.builder()
                .id(UUID.randomUUID())
                .userId(command.getHolderId())
                .skuId(sku.getId())
                .merchantId(command.getMerchantId())
                .partnerId(command.getPartnerId())
                .orderId(orderId)
                .amount(amount)
                .calculatedImpact(impactCalculator.calculate(amount, sku.getImpactMultiplier(), rate))
                .rateApplied(rate)
                .paymentStatus(PaymentStatus.COMPLETED)
                .connectFlag(sku.reachesConnectThreshold(amount))
                .walletCredited(true)
                .manual(true)
                .justification(command.getJustification())
                .createdBy(command.getActor())
                .build();

        ImpactTransaction saved = persist(transaction, null);
        creditWallets(saved);
        metrics.recordTransactionCreated("MANUAL", saved.getPaymentStatus().name());

        log.info("Manual transaction created: transactionId={}, skuCode={}, amount={}, impact={}, actor={}",
                saved.getId(), sku.getCode(), amount, saved.getCalculatedImpact(), command.getActor());
        return saved;
    }

    @Transactional(readOnly = true)
    public ImpactTransaction getTransaction(UUID transactionId) {
        return repository.findById(transactionId)
                .map(ImpactTransactionEntity::toDomain)
                .orElseThrow(() -> new NotFoundException("Transaction", transactionId));
    }

    @Transactional(readOnly = true)
    public List<ImpactTransaction> listForHolder(UUID userId) {
        return repository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(ImpactTransactionEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ImpactTransaction> listForMerchant(UUID merchantId) {
        return repository.findByMerchantIdOrderByCreatedAtDesc(merchantId).stream()
                .map(ImpactTransactionEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ImpactTransaction> listForPartner(UUID partnerId) {
        return repository.findByPartnerIdOrderByCreatedAtDesc(partnerId).stream()
                .map(ImpactTransactionEntity::toDomain)
                .toList();
    }

    /**
     * Sum of impact credited to the user's wallet by transactions. Together with the
     * wallet's adjustments this accounts for its accumulated total.
     */
    @Transactional(readOnly = true)
    public BigDecimal sumCreditedImpact(UUID userId) {
        return repository.sumCreditedImpact(userId);
    }

    /**
     * Binds the payment processor's reference to a pending transaction, once.
     * Binding the reference it already has is a no-op.
     *
     * @throws InvalidTransitionException if the transaction is no longer pending or
     *         already carries a different reference
     */
    @Transactional
    public ImpactTransaction attachProcessorReference(UUID transactionId, String reference) {
        if (reference == null || reference.isBlank()) {
            throw new ValidationFailedException("Processor reference is required");
        }
        ImpactTransaction transaction = getTransaction(transactionId);
        if (reference.equals(transaction.getProcessorReference())) {
            return transaction;
        }
        if (transaction.getProcessorReference() != null) {
            throw new InvalidTransitionException(
                    "Transaction " + transactionId + " is already bound to another processor reference");
        }
        if (!transaction.isPending()) {
            throw new InvalidTransitionException(
                    "Cannot bind a processor reference to a " + transaction.getPaymentStatus().getWireValue()
                            + " transaction: " + transactionId);
        }

        int updated;
        try {
            updated = repository.bindProcessorReference(transactionId, reference, PaymentStatus.PENDING, Instant.now());
        } catch (DataIntegrityViolationException e) {
            throw new ConstraintViolationException("Processor reference already in use: " + reference, e);
        }
        if (updated == 0) {
            ImpactTransaction current = getTransaction(transactionId);
            if (reference.equals(current.getProcessorReference())) {
                return current;
            }
            throw new InvalidTransitionException(
                    "Transaction " + transactionId + " changed while binding its processor reference");
        }
        log.info("Processor reference bound: transactionId={}", transactionId);
        return getTransaction(transactionId);
    }

    /**
     * Credits the user's wallet, and the merchant's when one is attributed, sets the user's
     * connect flag when the transaction carries it, then records the fact in the outbox.
     * Callers guarantee this runs once per transaction.
     */
    void creditWallets(ImpactTransaction transaction) {
        walletLedger.credit(Holder.user(transaction.getUserId()),
                transaction.getCalculatedImpact(), transaction.getAmount());
        if (transaction.getMerchantId() != null) {
            walletLedger.credit(Holder.merchant(transaction.getMerchantId()),
                    transaction.getCalculatedImpact(), transaction.getAmount());
        }
        boolean newlyConnected = transaction.isConnectFlag() && holderService.markConnected(transaction.getUserId());

        outboxService.saveEvent(AGGREGATE_TYPE, transaction.getId(),
                TransactionCreditedEvent.EVENT_TYPE, TransactionCreditedEvent.fromTransaction(transaction, newlyConnected));
        metrics.recordImpactCredited(transaction.getCalculatedImpact());
    }

    private Sku resolveSku(CreateTransactionCommand command) {
        if (command.getSkuId() != null) {
            return catalogService.getActiveById(command.getSkuId());
        }
        if (command.getSkuCode() == null || command.getSkuCode().isBlank()) {
            throw new ValidationFailedException("A SKU id or code is required");
        }
        return catalogService.getActiveByCode(command.getSkuCode());
    }

    private void requireParties(UUID holderId, UUID merchantId, UUID partnerId) {
        holderService.requireExists(Holder.user(holderId));
        if (merchantId != null) {
            holderService.requireExists(Holder.merchant(merchantId));
        }
        if (partnerId != null) {
            holderService.requirePartner(partnerId);
        }
    }

    /**
     * CLAIM, GIFT_CARD and PAY always take the SKU price; the processor confirms a payment,
     * not an amount, so a client-sent PAY amount is ignored. ALLOCATION needs an explicit amount.
     */
    private BigDecimal resolveAmount(Sku sku, BigDecimal requested) {
        AcquisitionMode mode = sku.getAcquisitionMode();
        BigDecimal amount;
        if (mode.usesSkuPrice()) {
            if (requested != null && requested.compareTo(sku.getPrice()) != 0) {
                log.debug("Requested amount {} ignored for {} SKU {}", requested, mode, sku.getCode());
            }
            amount = sku.getPrice();
        } else {
            if (requested == null) {
                throw new InvalidValueException("An amount is required for " + mode + " SKU " + sku.getCode());
            }
            amount = requested;
        }

        if (amount.signum() < 0 || (mode.involvesPayment() && amount.signum() == 0)) {
            throw new InvalidValueException(String.format(
                    "Amount must be greater than zero for %s SKU %s: %s", mode, sku.getCode(), amount));
        }
        return impactCalculator.normalizeAmount(amount);
    }

    private ImpactTransaction persist(ImpactTransaction transaction, String idempotencyKey) {
        try {
            return repository.saveAndFlush(ImpactTransactionEntity.fromDomain(transaction, idempotencyKey))
                    .toDomain();
        } catch (DataIntegrityViolationException e) {
            throw new ConstraintViolationException("Transaction conflicts with an existing one", e);
        }
    }
}
