package com.flagship.impact_ledger.pricing;

import java.math.BigDecimal;

/**
 * Source of the current currency-per-impact-unit rate.
 *
 * The rate is global mutable state: a change applies to transactions created afterwards
 * and never to transactions already recorded.
 */
public interface PricingOracle {

    /**
     * @return the current rate, always strictly positive
     * @throws com.flagship.impact_ledger.common.exception.InvalidValueException
     *         if the stored rate is missing, unparseable or not positive
     */
    BigDecimal getRate();

    /**
     * Replaces the rate and records who changed it.
     *
     * @return the previous rate, or null if none was stored
     * @throws com.flagship.impact_ledger.common.exception.InvalidValueException if newRate is null or not positive
     * @throws com.flagship.impact_ledger.common.exception.ValidationFailedException if actor is blank
     */
    BigDecimal setRate(BigDecimal newRate, String actor);
}
