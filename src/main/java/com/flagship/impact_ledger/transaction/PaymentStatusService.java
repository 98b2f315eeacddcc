package com.flagship.impact_ledger.transaction;

import com.flagship.impact_ledger.common.exception.InvalidTransitionException;
import com.flagship.impact_ledger.common.exception.InvalidValueException;
import com.flagship.impact_ledger.common.exception.NotFoundException;
import com.flagship.impact_ledger.common.exception.ValidationFailedException;
import com.flagship.impact_ledger.observability.CorrelationContext;
import com.flagship.impact_ledger.observability.LedgerMetrics;
import com.flagship.impact_ledger.outbox.OutboxService;
import com.flagship.impact_ledger.transaction.event.TransactionFailedEvent;
import com.flagship.impact_ledger.wallet.Holder;
import com.flagship.impact_ledger.wallet.WalletAdjustment;
import com.flagship.impact_ledger.wallet.WalletLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies payment processor outcomes to pending transactions.
 *
 * Processor deliveries may repeat and arrive in any order. A replay of the outcome a
 * transaction already has is a no-op; any other event for a terminal transaction is
 * rejected. The status change itself is a conditional update on {@code PENDING}, so
 * two concurrent deliveries cannot both apply wallet effects.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentStatusService {

    static final String REVERSAL_REASON = "Reversal of failed payment for transaction %s";

    private final ImpactTransactionRepository repository;
    private final TransactionManager transactionManager;
    private final WalletLedger walletLedger;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;

    /**
     * @param processorReference the processor's id for the payment; may be null when
     *                           {@code transactionId} is given
     * @param target             COMPLETED or FAILED
     * @param transactionId      optional; used to find, and bind, a transaction the
     *                           processor reference is not yet bound to
     * @return the transaction as it stands after the event
     */
    @Transactional
    public ImpactTransaction onProcessorEvent(String processorReference, PaymentStatus target, UUID transactionId) {
        String targetTag = target != null ? target.name() : "unknown";
        if (target != PaymentStatus.COMPLETED && target != PaymentStatus.FAILED) {
            metrics.recordStatusTransition(targetTag, "rejected");
            throw new InvalidTransitionException("Processor events can only complete or fail a transaction, got: "
                    + (target != null ? target.getWireValue() : null));
        }

        try {
            ImpactTransaction transaction = locate(processorReference, transactionId);
            MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transaction.getId().toString());

            if (!transaction.requiresTransitionTo(target)) {
                log.info("Replayed processor event ignored: status={}", target.getWireValue());
                metrics.recordStatusTransition(targetTag, "replayed");
                return transaction;
            }

            int updated = repository.transitionStatus(transaction.getId(), PaymentStatus.PENDING, target, Instant.now());
            if (updated == 0) {
                // A concurrent delivery moved it first; re-read and judge again
                ImpactTransaction current = transactionManager.getTransaction(transaction.getId());
                if (!current.requiresTransitionTo(target)) {
                    log.info("Concurrent processor event already applied: status={}", target.getWireValue());
                    metrics.recordStatusTransition(targetTag, "replayed");
                    return current;
                }
                throw new InvalidTransitionException(transaction.getId(),
                        current.getPaymentStatus().getWireValue(), target.getWireValue());
            }

            if (target == PaymentStatus.COMPLETED) {
                applyDeferredCredit(transaction);
            } else {
                reverseCreditIfAny(transaction);
            }

            metrics.recordStatusTransition(targetTag, "applied");
            log.info("Payment status changed: from={}, to={}, amount={}, impact={}",
                    transaction.getPaymentStatus().getWireValue(), target.getWireValue(),
                    transaction.getAmount(), transaction.getCalculatedImpact());
            return transactionManager.getTransaction(transaction.getId());

        } catch (InvalidTransitionException e) {
            metrics.recordStatusTransition(targetTag, "rejected");
            log.warn("Processor event rejected: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordStatusTransition(targetTag, "error");
            log.error("Processor event failed: target={}, error={}", target.getWireValue(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    @Transactional
    public ImpactTransaction complete(String processorReference) {
        return onProcessorEvent(processorReference, PaymentStatus.COMPLETED, null);
    }

    @Transactional
    public ImpactTransaction fail(String processorReference) {
        return onProcessorEvent(processorReference, PaymentStatus.FAILED, null);
    }

    private ImpactTransaction locate(String processorReference, UUID transactionId) {
        boolean hasReference = processorReference != null && !processorReference.isBlank();
        if (!hasReference && transactionId == null) {
            throw new ValidationFailedException("A processor reference or transaction id is required");
        }

        if (hasReference) {
            Optional<ImpactTransaction> byReference = repository.findByProcessorReference(processorReference)
                    .map(ImpactTransactionEntity::toDomain);
            if (byReference.isPresent()) {
                ImpactTransaction found = byReference.get();
                if (transactionId != null && !transactionId.equals(found.getId())) {
                    throw new InvalidValueException("Processor reference belongs to another transaction");
                }
                return found;
            }
            if (transactionId == null) {
                throw new NotFoundException("Transaction with processor reference", processorReference);
            }
        }

        ImpactTransaction transaction = transactionManager.getTransaction(transactionId);
        if (hasReference && transaction.getProcessorReference() == null && transaction.isPending()) {
            return transactionManager.attachProcessorReference(transactionId, processorReference);
        }
        if (hasReference && transaction.getProcessorReference() != null) {
            throw new InvalidValueException("Transaction " + transactionId + " is bound to another processor reference");
        }
        return transaction;
    }

    /**
     * PAY credits wait for completion. The flag flip makes the credit happen at most once
     * even if it was recorded by another path.
     */
    private void applyDeferredCredit(ImpactTransaction transaction) {
        if (transaction.isWalletCredited()) {
            return;
        }
        if (repository.markWalletCredited(transaction.getId(), Instant.now()) == 1) {
            transactionManager.creditWallets(transaction.toBuilder()
                    .paymentStatus(PaymentStatus.COMPLETED)
                    .walletCredited(true)
                    .build());
        }
    }

    /**
     * Allocations are credited at creation; if their payment fails the credit is taken back
     * with a system adjustment tied to the transaction. Impact the user already redeemed
     * cannot be taken back; the failure is still recorded and the shortfall is published
     * for manual correction.
     */
    private void reverseCreditIfAny(ImpactTransaction transaction) {
        BigDecimal reversed = BigDecimal.ZERO;
        BigDecimal unreversed = BigDecimal.ZERO;
        if (transaction.isWalletCredited() && transaction.getCalculatedImpact().signum() > 0) {
            String reason = String.format(REVERSAL_REASON, transaction.getId());
            WalletAdjustment userReversal = walletLedger.reverseCredit(Holder.user(transaction.getUserId()),
                    transaction.getCalculatedImpact(), transaction.getAmount(), reason, transaction.getId());
            if (transaction.getMerchantId() != null) {
                walletLedger.reverseCredit(Holder.merchant(transaction.getMerchantId()),
                        transaction.getCalculatedImpact(), transaction.getAmount(), reason, transaction.getId());
            }
            reversed = userReversal.getImpactDelta().negate();
            unreversed = transaction.getCalculatedImpact().subtract(reversed);
            if (unreversed.signum() > 0) {
                log.warn("Failed allocation only partly reversed: transactionId={}, userId={}, reversed={}, shortfall={}",
                        transaction.getId(), transaction.getUserId(), reversed, unreversed);
            }
        }

        ImpactTransaction failed = transaction.toBuilder().paymentStatus(PaymentStatus.FAILED).build();
        outboxService.saveEvent(TransactionManager.AGGREGATE_TYPE, transaction.getId(),
                TransactionFailedEvent.EVENT_TYPE, TransactionFailedEvent.fromTransaction(failed, reversed, unreversed));
    }
}
