package com.flagship.impact_ledger.wallet;

import com.flagship.impact_ledger.common.exception.InvalidValueException;
import com.flagship.impact_ledger.common.exception.NotFoundException;
import com.flagship.impact_ledger.common.exception.ValidationFailedException;
import com.flagship.impact_ledger.pricing.GlobalConfigPricingOracle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns every write to the {@code wallets} table.
 *
 * Credits, debits and adjustments are all relative deltas applied by one UPDATE statement
 * ({@link #applyDelta}) that also recomputes the balance and the certified asset flag.
 * The row lock taken by that UPDATE is what serializes concurrent writers of one wallet;
 * there is no read-modify-write in Java.
 *
 * Database CHECK constraints back the same rules:
 * exactly one holder column, balance = accumulated - redeemed, balance never negative.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletLedger {

    public static final String SYSTEM_ACTOR = "system";

    private static final String SELECT_WALLET =
        "SELECT id, user_id, merchant_id, total_accumulated, total_redeemed, current_balance, " +
        "total_amount_spent, certified_asset_status, created_at, updated_at FROM wallets ";

    private final JdbcTemplate jdbcTemplate;
    private final HolderService holderService;
    private final GlobalConfigPricingOracle pricingOracle;

    /**
     * Returns the holder's wallet, creating an empty one on first use.
     * Concurrent first uses converge on one row through the partial unique index.
     */
    @Transactional
    public Wallet getOrCreate(Holder holder) {
        holderService.requireExists(holder);

        Optional<Wallet> existing = findWallet(holder);
        if (existing.isPresent()) {
            return existing.get();
        }

        int inserted = jdbcTemplate.update(
            "INSERT INTO wallets (id, " + holder.getType().walletColumn() + ", created_at, updated_at) " +
            "VALUES (?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP) ON CONFLICT DO NOTHING",
            UUID.randomUUID(),
            holder.getId()
        );
        if (inserted == 1) {
            log.info("Created wallet: holder={}", holder);
        }
        return findWallet(holder).orElseThrow(() -> new NotFoundException("Wallet", holder));
    }

    /**
     * Credits impact earned by a transaction.
     *
     * @param currencyAmount amount spent, added to {@code totalAmountSpent}
     */
    @Transactional
    public Wallet credit(Holder holder, BigDecimal impact, BigDecimal currencyAmount) {
        requireNonNegative(impact, "Credit impact");
        requireNonNegative(currencyAmount, "Credit amount");

        Wallet wallet = getOrCreate(holder);
        applyDelta(wallet.getId(), impact, BigDecimal.ZERO, currencyAmount, null);

        log.debug("Wallet credited: holder={}, impact={}, amount={}", holder, impact, currencyAmount);
        return requireWallet(wallet.getId());
    }

    /**
     * Redeems impact from the balance.
     *
     * @throws InvalidValueException if the amount is not positive or exceeds the current balance
     */
    @Transactional
    public Wallet debit(Holder holder, BigDecimal impact) {
        if (impact == null || impact.signum() <= 0) {
            throw new InvalidValueException("Debit impact must be greater than zero: " + impact);
        }
        Wallet wallet = getWallet(holder);

        int updated = applyDelta(wallet.getId(), BigDecimal.ZERO, impact, BigDecimal.ZERO, impact);
        if (updated == 0) {
            throw new InvalidValueException(String.format(
                "Insufficient balance for %s: requested=%s", holder, impact));
        }

        log.info("Wallet debited: holder={}, impact={}", holder, impact);
        return requireWallet(wallet.getId());
    }

    /**
     * Administrative correction. A negative delta removes impact from the accumulated total
     * and may not take the balance below zero.
     */
    @Transactional
    public WalletAdjustment adjust(Holder holder, BigDecimal impactDelta, String reason, String actor) {
        return adjust(holder, impactDelta, BigDecimal.ZERO, reason, actor, null);
    }

    /**
     * Administrative or system correction, optionally tied to the transaction it reverses.
     *
     * @param amountDelta signed change to {@code totalAmountSpent}
     */
    @Transactional
    public WalletAdjustment adjust(Holder holder, BigDecimal impactDelta, BigDecimal amountDelta,
                                   String reason, String actor, UUID transactionId) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationFailedException("Adjustment reason is required");
        }
        if (actor == null || actor.isBlank()) {
            throw new ValidationFailedException("Adjustment actor is required");
        }
        if (impactDelta == null || impactDelta.signum() == 0) {
            throw new InvalidValueException("Adjustment delta must be non-zero");
        }
        BigDecimal delta = impactDelta.setScale(2, RoundingMode.HALF_UP);
        if (delta.signum() == 0) {
            throw new InvalidValueException("Adjustment delta rounds to zero: " + impactDelta);
        }
        BigDecimal spentDelta = amountDelta != null ? amountDelta : BigDecimal.ZERO;

        Wallet wallet = getOrCreate(holder);
        BigDecimal guard = delta.signum() < 0 ? delta.negate() : null;
        int updated = applyDelta(wallet.getId(), delta, BigDecimal.ZERO, spentDelta, guard);
        if (updated == 0) {
            throw new InvalidValueException(String.format(
                "Adjustment would make the balance of %s negative: delta=%s", holder, delta));
        }

        UUID adjustmentId = insertAdjustment(wallet.getId(), delta, spentDelta, reason, actor, transactionId);

        log.info("Wallet adjusted: holder={}, delta={}, amountDelta={}, actor={}, transactionId={}",
                holder, delta, spentDelta, actor, transactionId);
        return requireAdjustment(adjustmentId);
    }

    /**
     * Takes back a credit whose payment later failed, as far as the current balance allows.
     * Impact the holder already redeemed cannot be recovered here; it stays on the wallet and
     * the adjustment reason records the shortfall. Never rejects for lack of balance.
     *
     * @param impact         the impact originally credited, positive
     * @param currencyAmount the amount originally credited, removed from {@code totalAmountSpent} in full
     * @return the adjustment written; its {@code impactDelta} is the negated impact actually taken back
     */
    @Transactional
    public WalletAdjustment reverseCredit(Holder holder, BigDecimal impact, BigDecimal currencyAmount,
                                          String reason, UUID transactionId) {
        requireNonNegative(impact, "Reversal impact");
        requireNonNegative(currencyAmount, "Reversal amount");
        if (reason == null || reason.isBlank()) {
            throw new ValidationFailedException("Adjustment reason is required");
        }
        Wallet wallet = getWallet(holder);

        BigDecimal balance = jdbcTemplate.queryForObject(
            "SELECT current_balance FROM wallets WHERE id = ? FOR UPDATE",
            BigDecimal.class,
            wallet.getId()
        );
        BigDecimal requested = impact.setScale(2, RoundingMode.HALF_UP);
        BigDecimal reversible = requested.min(balance).setScale(2, RoundingMode.HALF_UP);
        BigDecimal shortfall = requested.subtract(reversible);

        int updated = applyDelta(wallet.getId(), reversible.negate(), BigDecimal.ZERO, currencyAmount.negate(), reversible);
        if (updated == 0) {
            throw new IllegalStateException("Locked wallet changed during reversal: " + wallet.getId());
        }

        String recorded = reason;
        if (shortfall.signum() > 0) {
            recorded = String.format("%s (shortfall %s already redeemed)", reason, shortfall.toPlainString());
            log.warn("Reversal short of balance: holder={}, requested={}, reversed={}, shortfall={}, transactionId={}",
                    holder, requested, reversible, shortfall, transactionId);
        }
        UUID adjustmentId = insertAdjustment(wallet.getId(), reversible.negate(), currencyAmount.negate(),
                recorded, SYSTEM_ACTOR, transactionId);

        log.info("Wallet credit reversed: holder={}, impact={}, amount={}, transactionId={}",
                holder, reversible, currencyAmount, transactionId);
        return requireAdjustment(adjustmentId);
    }

    /**
     * The single wallet mutation. Deltas are added to the stored values, so concurrent
     * callers never overwrite each other's effect. {@code current_balance} and
     * {@code certified_asset_status} are derived from the pre-update row plus the deltas.
     *
     * @param minimumBalance when not null, the update only applies if the current balance
     *                       is at least this value
     * @return number of rows updated: 0 when the guard rejected the change
     */
    int applyDelta(UUID walletId, BigDecimal accumulatedDelta, BigDecimal redeemedDelta,
                   BigDecimal spentDelta, BigDecimal minimumBalance) {
        BigDecimal threshold = pricingOracle.getCertifiedAssetThreshold();

        StringBuilder sql = new StringBuilder(
            "UPDATE wallets SET " +
            "total_accumulated = total_accumulated + ?, " +
            "total_redeemed = total_redeemed + ?, " +
            "current_balance = (total_accumulated + ?) - (total_redeemed + ?), " +
            "total_amount_spent = total_amount_spent + ?, " +
            "certified_asset_status = (total_amount_spent + ?) >= ?, " +
            "updated_at = ? " +
            "WHERE id = ?");
        List<Object> args = new ArrayList<>(List.of(
            accumulatedDelta, redeemedDelta,
            accumulatedDelta, redeemedDelta,
            spentDelta,
            spentDelta, threshold,
            new Timestamp(System.currentTimeMillis()),
            walletId));
        if (minimumBalance != null) {
            sql.append(" AND current_balance >= ?");
            args.add(minimumBalance);
        }

        return jdbcTemplate.update(sql.toString(), args.toArray());
    }

    @Transactional(readOnly = true)
    public Wallet getWallet(Holder holder) {
        return findWallet(holder).orElseThrow(() -> new NotFoundException("Wallet", holder));
    }

    @Transactional(readOnly = true)
    public Optional<Wallet> findWallet(Holder holder) {
        return jdbcTemplate.query(
            SELECT_WALLET + "WHERE " + holder.getType().walletColumn() + " = ?",
            walletRowMapper(),
            holder.getId()
        ).stream().findFirst();
    }

    /**
     * Adjustments of the holder's wallet, newest first. Empty if the holder has no wallet yet.
     */
    @Transactional(readOnly = true)
    public List<WalletAdjustment> getAdjustmentHistory(Holder holder) {
        holderService.requireExists(holder);
        return jdbcTemplate.query(
            "SELECT a.id, a.wallet_id, a.impact_delta, a.amount_delta, a.reason, a.adjusted_by, " +
            "a.transaction_id, a.adjusted_at " +
            "FROM wallet_adjustments a JOIN wallets w ON w.id = a.wallet_id " +
            "WHERE w." + holder.getType().walletColumn() + " = ? " +
            "ORDER BY a.adjusted_at DESC, a.id",
            adjustmentRowMapper(),
            holder.getId()
        );
    }

    private UUID insertAdjustment(UUID walletId, BigDecimal impactDelta, BigDecimal amountDelta,
                                  String reason, String actor, UUID transactionId) {
        UUID adjustmentId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO wallet_adjustments " +
            "(id, wallet_id, impact_delta, amount_delta, reason, adjusted_by, transaction_id, adjusted_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            adjustmentId,
            walletId,
            impactDelta,
            amountDelta,
            reason,
            actor,
            transactionId
        );
        return adjustmentId;
    }

    private WalletAdjustment requireAdjustment(UUID adjustmentId) {
        return jdbcTemplate.queryForObject(
            "SELECT id, wallet_id, impact_delta, amount_delta, reason, adjusted_by, transaction_id, adjusted_at " +
            "FROM wallet_adjustments WHERE id = ?",
            adjustmentRowMapper(),
            adjustmentId
        );
    }

    private Wallet requireWallet(UUID walletId) {
        return jdbcTemplate.query(SELECT_WALLET + "WHERE id = ?", walletRowMapper(), walletId)
                .stream()
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Wallet", walletId));
    }

    private static void requireNonNegative(BigDecimal value, String what) {
        if (value == null || value.signum() < 0) {
            throw new InvalidValueException(what + " must be zero or positive: " + value);
        }
    }

    private RowMapper<Wallet> walletRowMapper() {
        return (rs, rowNum) -> {
            String userId = rs.getString("user_id");
            String merchantId = rs.getString("merchant_id");
            return new Wallet(
                UUID.fromString(rs.getString("id")),
                userId != null ? UUID.fromString(userId) : null,
                merchantId != null ? UUID.fromString(merchantId) : null,
                rs.getBigDecimal("total_accumulated"),
                rs.getBigDecimal("total_redeemed"),
                rs.getBigDecimal("current_balance"),
                rs.getBigDecimal("total_amount_spent"),
                rs.getBoolean("certified_asset_status"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant()
            );
        };
    }

    private RowMapper<WalletAdjustment> adjustmentRowMapper() {
        return (rs, rowNum) -> {
            String transactionId = rs.getString("transaction_id");
            return new WalletAdjustment(
                UUID.fromString(rs.getString("id")),
                UUID.fromString(rs.getString("wallet_id")),
                rs.getBigDecimal("impact_delta"),
                rs.getBigDecimal("amount_delta"),
                rs.getString("reason"),
                rs.getString("adjusted_by"),
                transactionId != null ? UUID.fromString(transactionId) : null,
                rs.getTimestamp("adjusted_at").toInstant()
            );
        };
    }
}
