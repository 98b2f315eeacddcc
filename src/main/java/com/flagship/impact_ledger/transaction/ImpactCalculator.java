package com.flagship.impact_ledger.transaction;

import com.flagship.impact_ledger.common.exception.InvalidValueException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Converts a currency amount into impact units:
 * {@code impact = (amount / rate) * multiplier}.
 *
 * The same formula serves every acquisition mode. The division runs at DECIMAL128
 * precision and only the final result is rounded (scale 2, HALF_UP), so equal inputs
 * always give equal outputs.
 */
@Component
public class ImpactCalculator {

    public static final int AMOUNT_SCALE = 4;
    public static final int IMPACT_SCALE = 2;

    public BigDecimal calculate(BigDecimal amount, BigDecimal multiplier, BigDecimal rate) {
        if (rate == null || rate.signum() <= 0) {
            throw new InvalidValueException("Impact rate must be greater than zero: " + rate);
        }
        if (amount == null || amount.signum() < 0) {
            throw new InvalidValueException("Amount must be zero or positive: " + amount);
        }
        if (multiplier == null || multiplier.signum() < 0) {
            throw new InvalidValueException("Impact multiplier must be zero or positive: " + multiplier);
        }

        return normalizeAmount(amount)
                .divide(rate, MathContext.DECIMAL128)
                .multiply(multiplier)
                .setScale(IMPACT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Amounts are carried with four decimals.
     */
    public BigDecimal normalizeAmount(BigDecimal amount) {
        return amount.setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
    }
}
