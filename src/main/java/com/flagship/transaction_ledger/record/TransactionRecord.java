package com.flagship.transaction_ledger.record;

import lombok.Value;

import java.util.Objects;
import java.util.Optional;

/**
 * One input event of the transaction stream.
 *
 * Immutable once created. The amount is only meaningful for deposits and withdrawals;
 * the ledger decides whether a missing or non-positive amount is acceptable.
 *
 * Invariant: client fits the unsigned 16-bit range and tx the unsigned 32-bit range.
 */
@Value
public class TransactionRecord {

    public static final int MAX_CLIENT_ID = 0xFFFF;
    public static final long MAX_TX_ID = 0xFFFF_FFFFL;

    TransactionKind kind;
    int client;
    long tx;
    Double amount;

    private TransactionRecord(TransactionKind kind, int client, long tx, Double amount) {
        this.kind = Objects.requireNonNull(kind, "kind");
        if (client < 0 || client > MAX_CLIENT_ID) {
            throw new IllegalArgumentException("Client id out of range: " + client);
        }
        if (tx < 0 || tx > MAX_TX_ID) {
            throw new IllegalArgumentException("Transaction id out of range: " + tx);
        }
        this.client = client;
        this.tx = tx;
        this.amount = amount;
    }

    public static TransactionRecord of(TransactionKind kind, int client, long tx, Double amount) {
        return new TransactionRecord(kind, client, tx, amount);
    }

    public static TransactionRecord deposit(int client, long tx, double amount) {
        return new TransactionRecord(TransactionKind.DEPOSIT, client, tx, amount);
    }

    public static TransactionRecord withdrawal(int client, long tx, double amount) {
        return new TransactionRecord(TransactionKind.WITHDRAWAL, client, tx, amount);
    }

    public static TransactionRecord dispute(int client, long tx) {
        return new TransactionRecord(TransactionKind.DISPUTE, client, tx, null);
    }

    public static TransactionRecord resolve(int client, long tx) {
        return new TransactionRecord(TransactionKind.RESOLVE, client, tx, null);
    }

    public static TransactionRecord chargeback(int client, long tx) {
        return new TransactionRecord(TransactionKind.CHARGEBACK, client, tx, null);
    }

    public Optional<Double> amount() {
        return Optional.ofNullable(amount);
    }

    /**
     * Amount, or 0.0 when the record carries none.
     */
    public double amountOrZero() {
        return amount != null ? amount : 0.0;
    }
}
