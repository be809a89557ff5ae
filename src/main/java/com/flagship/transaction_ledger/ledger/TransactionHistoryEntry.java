package com.flagship.transaction_ledger.ledger;

import com.flagship.transaction_ledger.record.TransactionRecord;
import lombok.Getter;
import lombok.ToString;

/**
 * A deposit or withdrawal kept by the ledger so that later disputes can reference it.
 *
 * Dispute lifecycle: normal -> disputed -> normal (resolved or charged back).
 */
@Getter
@ToString
public class TransactionHistoryEntry {

    private final TransactionRecord record;
    private boolean underDispute;

    TransactionHistoryEntry(TransactionRecord record) {
        if (!record.getKind().isFundsMovement()) {
            throw new IllegalArgumentException("Only deposits and withdrawals are kept in the history, got " + record.getKind());
        }
        this.record = record;
    }

    public long getTx() {
        return record.getTx();
    }

    /**
     * Amount the entry moved, 0.0 if the stored record had none.
     */
    public double getAmount() {
        return record.amountOrZero();
    }

    void markDisputed() {
        underDispute = true;
    }

    void clearDispute() {
        underDispute = false;
    }
}
