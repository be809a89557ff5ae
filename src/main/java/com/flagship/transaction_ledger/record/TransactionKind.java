package com.flagship.transaction_ledger.record;

import java.util.Locale;

/**
 * Kind of a transaction record.
 *
 * Deposits and withdrawals carry an amount and are kept in the ledger history.
 * Disputes, resolves and chargebacks only reference an earlier deposit or withdrawal by tx id.
 */
public enum TransactionKind {
    DEPOSIT,
    WITHDRAWAL,
    DISPUTE,
    RESOLVE,
    CHARGEBACK;

    /**
     * Whether records of this kind move funds and are stored in the transaction history.
     */
    public boolean isFundsMovement() {
        return this == DEPOSIT || this == WITHDRAWAL;
    }

    /**
     * Resolves a kind from its input code, ignoring case and surrounding whitespace.
     *
     * @throws IllegalArgumentException if the code does not name a known kind
     */
    public static TransactionKind fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Transaction type is required");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (TransactionKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown transaction type: " + code);
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
