package com.flagship.transaction_ledger.ledger;

import lombok.Getter;
import lombok.ToString;

/**
 * Mutable funds of a single client, owned by the {@link Ledger}.
 *
 * Key invariant: total == available + held after every successful ledger operation.
 * Once locked, an account stays locked for the rest of the run.
 */
@Getter
@ToString
public class Account {

    private final int client;
    private double available;
    private double held;
    private double total;
    private boolean locked;

    Account(int client) {
        this.client = client;
    }

    void credit(double amount) {
        available += amount;
        total += amount;
    }

    void debit(double amount) {
        available -= amount;
        total -= amount;
    }

    void hold(double amount) {
        available -= amount;
        held += amount;
    }

    void release(double amount) {
        held -= amount;
        available += amount;
    }

    void chargeBack(double amount) {
        held -= amount;
        total -= amount;
        locked = true;
    }

    AccountSnapshot snapshot() {
        return new AccountSnapshot(client, available, held, total, locked);
    }
}
