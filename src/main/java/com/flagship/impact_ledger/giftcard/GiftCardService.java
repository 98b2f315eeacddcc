package com.flagship.impact_ledger.giftcard;

import com.flagship.impact_ledger.catalog.AcquisitionMode;
import com.flagship.impact_ledger.catalog.CatalogService;
import com.flagship.impact_ledger.catalog.Sku;
import com.flagship.impact_ledger.common.exception.AlreadyRedeemedException;
import com.flagship.impact_ledger.common.exception.ConstraintViolationException;
import com.flagship.impact_ledger.common.exception.InvalidValueException;
import com.flagship.impact_ledger.common.exception.NotFoundException;
import com.flagship.impact_ledger.common.exception.ValidationFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Validates, issues and consumes gift card codes.
 *
 * Consumption is a single conditional UPDATE on the code row. Two concurrent redemptions
 * of the same code serialize on that row; the loser sees zero affected rows and gets
 * {@link AlreadyRedeemedException}. Called inside the transaction-creation unit, so a
 * rollback there leaves the code unredeemed.
 */
@Service
@Slf4j
public class GiftCardService {

    static final int MAX_BATCH_SIZE = 1000;
    private static final String CODE_ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private static final String SELECT_CODE =
        "SELECT g.id, g.code, g.sku_id, g.is_redeemed, g.redeemed_by, g.redeemed_at, g.created_at " +
        "FROM gift_card_codes g ";

    private final JdbcTemplate jdbcTemplate;
    private final CatalogService catalogService;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    @Autowired
    public GiftCardService(JdbcTemplate jdbcTemplate, CatalogService catalogService) {
        this(jdbcTemplate, catalogService, Clock.systemUTC());
    }

    GiftCardService(JdbcTemplate jdbcTemplate, CatalogService catalogService, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.catalogService = catalogService;
        this.clock = clock;
    }

    /**
     * Consumes a code on behalf of a user.
     *
     * @param expectedSkuId when not null, the code must belong to this SKU
     * @return the code in its redeemed state
     * @throws NotFoundException if the code is unknown
     * @throws AlreadyRedeemedException if the code was consumed or invalidated before
     * @throws InvalidValueException if the code belongs to another SKU or to a non gift card SKU
     */
    @Transactional
    public GiftCardCode redeem(String code, UUID redeemerId, UUID expectedSkuId) {
        if (redeemerId == null) {
            throw new ValidationFailedException("Redeemer is required");
        }
        GiftCardCode existing = requireRedeemable(code, expectedSkuId);

        Instant now = clock.instant();
        int updated = jdbcTemplate.update(
            "UPDATE gift_card_codes SET is_redeemed = TRUE, redeemed_by = ?, redeemed_at = ? " +
            "WHERE code = ? AND is_redeemed = FALSE",
            redeemerId,
            Timestamp.from(now),
            code
        );

        if (updated == 0) {
            // Lost the race after the pre-check
            throw resolveNotRedeemable(code);
        }

        log.info("Gift card code redeemed: code=...{}, skuId={}, redeemedBy={}",
                tail(code), existing.getSkuId(), redeemerId);
        return new GiftCardCode(existing.getId(), existing.getCode(), existing.getSkuId(),
                true, redeemerId, now, existing.getCreatedAt());
    }

    /**
     * Read-only pre-check with the same failures as {@link #redeem}. Consumes nothing.
     */
    @Transactional(readOnly = true)
    public GiftCardCode validate(String code, UUID expectedSkuId) {
        return requireRedeemable(code, expectedSkuId);
    }

    @Transactional(readOnly = true)
    public GiftCardCode getStatus(String code) {
        return findByCode(code).orElseThrow(() -> new NotFoundException("Gift card code", code));
    }

    /**
     * Lists the codes of a SKU, newest first.
     *
     * @param redeemed null for all codes, otherwise only codes in that state
     */
    @Transactional(readOnly = true)
    public List<GiftCardCode> listBySku(UUID skuId, Boolean redeemed) {
        if (redeemed == null) {
            return jdbcTemplate.query(SELECT_CODE + "WHERE g.sku_id = ? ORDER BY g.created_at DESC, g.code",
                    rowMapper(), skuId);
        }
        return jdbcTemplate.query(
                SELECT_CODE + "WHERE g.sku_id = ? AND g.is_redeemed = ? ORDER BY g.created_at DESC, g.code",
                rowMapper(), skuId, redeemed);
    }

    /**
     * Stores externally issued codes for a gift card SKU.
     *
     * @throws ConstraintViolationException if any code already exists or repeats in the batch
     */
    @Transactional
    public List<GiftCardCode> createCodes(UUID skuId, List<String> codes) {
        Sku sku = requireGiftCardSku(skuId);
        if (codes == null || codes.isEmpty()) {
            throw new ValidationFailedException("At least one code is required");
        }
        if (codes.size() > MAX_BATCH_SIZE) {
            throw new InvalidValueException("At most " + MAX_BATCH_SIZE + " codes can be created at once");
        }
        Set<String> seen = new HashSet<>();
        for (String code : codes) {
            if (code == null || code.isBlank()) {
                throw new ValidationFailedException("Gift card codes must not be blank");
            }
            if (!seen.add(code)) {
                throw new ConstraintViolationException("Duplicate gift card code in batch: ..." + tail(code));
            }
        }

        Instant now = clock.instant();
        List<GiftCardCode> created = new ArrayList<>(codes.size());
        List<Object[]> rows = new ArrayList<>(codes.size());
        for (String code : codes) {
            UUID id = UUID.randomUUID();
            created.add(new GiftCardCode(id, code, skuId, false, null, null, now));
            rows.add(new Object[]{id, code, skuId, Timestamp.from(now)});
        }

        try {
            jdbcTemplate.batchUpdate(
                "INSERT INTO gift_card_codes (id, code, sku_id, is_redeemed, created_at) VALUES (?, ?, ?, FALSE, ?)",
                rows
            );
        } catch (DataIntegrityViolationException e) {
            throw new ConstraintViolationException("One or more gift card codes already exist", e);
        }

        log.info("Created gift card codes: skuCode={}, count={}", sku.getCode(), created.size());
        return created;
    }

    /**
     * Generates {@code quantity} fresh codes of the form {@code SKUCODE-<time>-<random>-<index>}.
     */
    @Transactional
    public List<GiftCardCode> generateCodes(UUID skuId, int quantity) {
        if (quantity < 1 || quantity > MAX_BATCH_SIZE) {
            throw new InvalidValueException("Quantity must be between 1 and " + MAX_BATCH_SIZE + ": " + quantity);
        }
        Sku sku = requireGiftCardSku(skuId);

        String timePart = Long.toString(clock.millis(), 36).toUpperCase(Locale.ROOT);
        List<String> codes = new ArrayList<>(quantity);
        for (int i = 0; i < quantity; i++) {
            codes.add(String.format("%s-%s-%s-%04d", sku.getCode(), timePart, randomPart(4), i));
        }
        return createCodes(skuId, codes);
    }

    /**
     * Withdraws an unredeemed code. It stays in the table as redeemed with no redeemer.
     */
    @Transactional
    public GiftCardCode invalidate(String code) {
        Instant now = clock.instant();
        int updated = jdbcTemplate.update(
            "UPDATE gift_card_codes SET is_redeemed = TRUE, redeemed_by = NULL, redeemed_at = ? " +
            "WHERE code = ? AND is_redeemed = FALSE",
            Timestamp.from(now),
            code
        );
        if (updated == 0) {
            throw resolveNotRedeemable(code);
        }
        log.info("Gift card code invalidated: code=...{}", tail(code));
        return getStatus(code);
    }

    private GiftCardCode requireRedeemable(String code, UUID expectedSkuId) {
        if (code == null || code.isBlank()) {
            throw new ValidationFailedException("Gift card code is required");
        }
        GiftCardCode existing = findByCode(code)
                .orElseThrow(() -> new NotFoundException("Gift card code", "..." + tail(code)));

        Sku sku = catalogService.getById(existing.getSkuId());
        if (sku.getAcquisitionMode() != AcquisitionMode.GIFT_CARD) {
            throw new InvalidValueException("Code does not belong to a gift card SKU");
        }
        if (expectedSkuId != null && !Objects.equals(expectedSkuId, existing.getSkuId())) {
            throw new InvalidValueException("Gift card code is not valid for SKU " + expectedSkuId);
        }
        if (existing.isRedeemed()) {
            throw new AlreadyRedeemedException(code);
        }
        return existing;
    }

    private RuntimeException resolveNotRedeemable(String code) {
        return findByCode(code)
                .<RuntimeException>map(c -> new AlreadyRedeemedException(code))
                .orElseGet(() -> new NotFoundException("Gift card code", "..." + tail(code)));
    }

    private Sku requireGiftCardSku(UUID skuId) {
        Sku sku = catalogService.getById(skuId);
        if (sku.getAcquisitionMode() != AcquisitionMode.GIFT_CARD) {
            throw new InvalidValueException("SKU " + sku.getCode() + " is not a gift card SKU");
        }
        return sku;
    }

    private Optional<GiftCardCode> findByCode(String code) {
        return jdbcTemplate.query(SELECT_CODE + "WHERE g.code = ?", rowMapper(), code)
                .stream()
                .findFirst();
    }

    private String randomPart(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(CODE_ALPHABET.charAt(random.nextInt(CODE_ALPHABET.length())));
        }
        return sb.toString();
    }

    private static String tail(String code) {
        return code.length() <= 4 ? code : code.substring(code.length() - 4);
    }

    private RowMapper<GiftCardCode> rowMapper() {
        return (rs, rowNum) -> {
            String redeemedBy = rs.getString("redeemed_by");
            Timestamp redeemedAt = rs.getTimestamp("redeemed_at");
            return new GiftCardCode(
                UUID.fromString(rs.getString("id")),
                rs.getString("code"),
                UUID.fromString(rs.getString("sku_id")),
                rs.getBoolean("is_redeemed"),
                redeemedBy != null ? UUID.fromString(redeemedBy) : null,
                redeemedAt != null ? redeemedAt.toInstant() : null,
                rs.getTimestamp("created_at").toInstant()
            );
        };
    }
}
