package com.flagship.impact_ledger.catalog;

import com.flagship.impact_ledger.common.exception.ConstraintViolationException;
import com.flagship.impact_ledger.common.exception.InvalidValueException;
import com.flagship.impact_ledger.common.exception.NotFoundException;
import com.flagship.impact_ledger.common.exception.ValidationFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Read access to the SKU catalog, plus the minimal registration needed to seed it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogService {

    static final BigDecimal DEFAULT_MULTIPLIER = BigDecimal.ONE;
    static final BigDecimal DEFAULT_CONNECT_THRESHOLD = new BigDecimal("10.00");

    private final SkuRepository skuRepository;

    /**
     * Looks up an active SKU by its external code.
     * Inactive SKUs are reported exactly like unknown ones.
     */
    @Transactional(readOnly = true)
    public Sku getActiveByCode(String code) {
        return skuRepository.findByCodeAndActiveTrue(code)
                .map(SkuEntity::toDomain)
                .orElseThrow(() -> new NotFoundException("SKU", code));
    }

    @Transactional(readOnly = true)
    public Sku getActiveById(UUID skuId) {
        return skuRepository.findById(skuId)
                .filter(SkuEntity::isActive)
                .map(SkuEntity::toDomain)
                .orElseThrow(() -> new NotFoundException("SKU", skuId));
    }

    /**
     * Any SKU, active or not. Used when reading back historical transactions.
     */
    @Transactional(readOnly = true)
    public Sku getById(UUID skuId) {
        return skuRepository.findById(skuId)
                .map(SkuEntity::toDomain)
                .orElseThrow(() -> new NotFoundException("SKU", skuId));
    }

    @Transactional(readOnly = true)
    public List<Sku> listActive() {
        return skuRepository.findByActiveTrueOrderByCodeAsc().stream()
                .map(SkuEntity::toDomain)
                .toList();
    }

    /**
     * Registers a SKU. A null multiplier or threshold takes the catalog default.
     *
     * @throws ConstraintViolationException if the code is already taken
     */
    @Transactional
    public Sku registerSku(String code, String name, BigDecimal price, AcquisitionMode mode,
                           BigDecimal impactMultiplier, BigDecimal connectThreshold) {
        if (code == null || code.isBlank()) {
            throw new ValidationFailedException("SKU code is required");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationFailedException("SKU name is required");
        }
        if (mode == null) {
            throw new ValidationFailedException("Acquisition mode is required");
        }
        if (price == null || price.signum() < 0) {
            throw new InvalidValueException("SKU price must be zero or positive: " + price);
        }
        BigDecimal multiplier = impactMultiplier != null ? impactMultiplier : DEFAULT_MULTIPLIER;
        if (multiplier.signum() < 0) {
            throw new InvalidValueException("Impact multiplier must not be negative: " + multiplier);
        }
        if (skuRepository.existsByCode(code)) {
            throw new ConstraintViolationException("SKU code already exists: " + code);
        }

        SkuEntity entity = SkuEntity.create(code, name, price, mode, multiplier,
                connectThreshold != null ? connectThreshold : DEFAULT_CONNECT_THRESHOLD);
        try {
            SkuEntity saved = skuRepository.saveAndFlush(entity);
            log.info("Registered SKU: code={}, mode={}, price={}", code, mode, price);
            return saved.toDomain();
        } catch (DataIntegrityViolationException e) {
            throw new ConstraintViolationException("SKU code already exists: " + code, e);
        }
    }

    @Transactional
    public void deactivate(UUID skuId) {
        SkuEntity entity = skuRepository.findById(skuId)
                .orElseThrow(() -> new NotFoundException("SKU", skuId));
        entity.deactivate();
        log.info("Deactivated SKU: code={}", entity.getCode());
    }
}
