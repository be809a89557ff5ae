package com.flagship.transaction_ledger.replay;

/**
 * What a replay does when the ledger rejects a record.
 * Malformed input always stops the replay, whatever the policy.
 */
public enum ErrorPolicy {
    /**
     * Stop at the first rejected record and propagate the rejection.
     */
    HALT,

    /**
     * Log the rejected record, count it and continue with the next one.
     */
    SKIP
}
