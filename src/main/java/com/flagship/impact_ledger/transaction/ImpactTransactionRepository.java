package com.flagship.impact_ledger.transaction;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ImpactTransactionRepository extends JpaRepository<ImpactTransactionEntity, UUID> {

    Optional<ImpactTransactionEntity> findByProcessorReference(String processorReference);

    Optional<ImpactTransactionEntity> findByIdempotencyKey(String idempotencyKey);

    List<ImpactTransactionEntity> findByUserIdOrderByCreatedAtDesc(UUID userId);

    List<ImpactTransactionEntity> findByMerchantIdOrderByCreatedAtDesc(UUID merchantId);

    List<ImpactTransactionEntity> findByPartnerIdOrderByCreatedAtDesc(UUID partnerId);

    /**
     * Impact of every transaction whose credit reached the user's wallet.
     */
    @Query("""
        SELECT COALESCE(SUM(t.calculatedImpact), 0) FROM ImpactTransactionEntity t
        WHERE t.userId = :userId AND t.walletCredited = true
        """)
    BigDecimal sumCreditedImpact(@Param("userId") UUID userId);

    /**
     * Guarded status change. Returns 0 when the row is no longer in {@code expected},
     * typically because a concurrent delivery of the same event got there first.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ImpactTransactionEntity t
        SET t.paymentStatus = :target, t.updatedAt = :now
        WHERE t.id = :id AND t.paymentStatus = :expected
        """)
    int transitionStatus(@Param("id") UUID id,
                         @Param("expected") PaymentStatus expected,
                         @Param("target") PaymentStatus target,
                         @Param("now") Instant now);

    /**
     * Flips {@code wallet_credited} once. Returns 0 if the credit was already recorded.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ImpactTransactionEntity t
        SET t.walletCredited = true, t.updatedAt = :now
        WHERE t.id = :id AND t.walletCredited = false
        """)
    int markWalletCredited(@Param("id") UUID id, @Param("now") Instant now);

    /**
     * Binds a processor reference to a transaction in {@code expected} that has none yet.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ImpactTransactionEntity t
        SET t.processorReference = :reference, t.updatedAt = :now
        WHERE t.id = :id AND t.processorReference IS NULL
          AND t.paymentStatus = :expected
        """)
    int bindProcessorReference(@Param("id") UUID id,
                               @Param("reference") String reference,
                               @Param("expected") PaymentStatus expected,
                               @Param("now") Instant now);
}
