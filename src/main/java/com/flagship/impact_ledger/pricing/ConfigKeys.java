package com.flagship.impact_ledger.pricing;

/**
 * Keys of the {@code global_config} table the ledger reads.
 */
public final class ConfigKeys {

    /** Currency per impact unit. */
    public static final String CURRENT_CSR_PRICE = "CURRENT_CSR_PRICE";

    /** Total amount spent at which a wallet becomes a certified asset. */
    public static final String CORSAIR_THRESHOLD = "CORSAIR_THRESHOLD";

    private ConfigKeys() {
    }
}
