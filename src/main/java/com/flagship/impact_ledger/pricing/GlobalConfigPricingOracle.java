package com.flagship.impact_ledger.pricing;

import com.flagship.impact_ledger.common.exception.InvalidValueException;
import com.flagship.impact_ledger.common.exception.ValidationFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * {@link PricingOracle} backed by the {@code CURRENT_CSR_PRICE} config key.
 * Also exposes the certified-asset threshold, which lives in the same table.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GlobalConfigPricingOracle implements PricingOracle {

    static final BigDecimal DEFAULT_CERTIFIED_ASSET_THRESHOLD = new BigDecimal("10");

    private final GlobalConfigService configService;

    @Override
    public BigDecimal getRate() {
        String stored = configService.findValue(ConfigKeys.CURRENT_CSR_PRICE)
                .orElseThrow(() -> new InvalidValueException("No impact rate is configured"));
        BigDecimal rate = parse(stored);
        if (rate == null || rate.signum() <= 0) {
            log.error("Stored impact rate is unusable: value={}", stored);
            throw new InvalidValueException("Configured impact rate must be a positive decimal: " + stored);
        }
        return rate;
    }

    @Override
    @Transactional
    public BigDecimal setRate(BigDecimal newRate, String actor) {
        if (actor == null || actor.isBlank()) {
            throw new ValidationFailedException("Actor is required to change the impact rate");
        }
        if (newRate == null || newRate.signum() <= 0) {
            throw new InvalidValueException("Impact rate must be greater than zero: " + newRate);
        }
        String previous = configService.setValue(ConfigKeys.CURRENT_CSR_PRICE, newRate.toPlainString(), actor);
        return previous != null ? parse(previous) : null;
    }

    /**
     * Total amount spent at which a wallet becomes a certified asset.
     * Falls back to 10 when the key is missing or unreadable.
     */
    public BigDecimal getCertifiedAssetThreshold() {
        Optional<String> stored = configService.findValue(ConfigKeys.CORSAIR_THRESHOLD);
        if (stored.isEmpty()) {
            return DEFAULT_CERTIFIED_ASSET_THRESHOLD;
        }
        BigDecimal threshold = parse(stored.get());
        if (threshold == null || threshold.signum() < 0) {
            log.warn("Ignoring unusable certified asset threshold: value={}", stored.get());
            return DEFAULT_CERTIFIED_ASSET_THRESHOLD;
        }
        return threshold;
    }

    private static BigDecimal parse(String value) {
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
