package com.flagship.impact_ledger.wallet;

/**
 * Kind of party that owns a wallet. Each maps to one nullable foreign key on {@code wallets}.
 */
public enum HolderType {
    USER("user_id", "users"),
    MERCHANT("merchant_id", "merchants");

    private final String walletColumn;
    private final String table;

    HolderType(String walletColumn, String table) {
        this.walletColumn = walletColumn;
        this.table = table;
    }

    String walletColumn() {
        return walletColumn;
    }

    String table() {
        return table;
    }
}
