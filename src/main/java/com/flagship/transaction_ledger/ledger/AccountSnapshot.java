package com.flagship.transaction_ledger.ledger;

import lombok.Value;

/**
 * Read-only view of an account at export time.
 */
@Value
public class AccountSnapshot {
    int client;
    double available;
    double held;
    double total;
    boolean locked;
}
