package com.flagship.transaction_ledger.replay;

import com.flagship.transaction_ledger.ledger.AccountSnapshot;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a completed replay: final balances plus record counts.
 */
@Value
public class ReplaySummary {
    List<AccountSnapshot> accounts;
    long applied;
    long rejected;

    public long getProcessed() {
        return applied + rejected;
    }
}
