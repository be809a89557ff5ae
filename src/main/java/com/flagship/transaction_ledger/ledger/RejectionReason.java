package com.flagship.transaction_ledger.ledger;

/**
 * Why the ledger refused to apply a transaction record.
 */
public enum RejectionReason {
    /**
     * No account for the client. The ledger creates accounts on first reference,
     * so this is not expected to occur.
     */
    UNKNOWN_CLIENT,

    /**
     * A dispute, resolve or chargeback referenced a tx that is not in the history.
     */
    UNKNOWN_TRANSACTION,

    /**
     * Deposit or withdrawal amount is missing, not positive or not finite.
     */
    INVALID_AMOUNT,

    /**
     * A deposit did not change the account balance because of floating-point range limits.
     */
    AMOUNT_OVERFLOW,

    /**
     * Withdrawal amount exceeds available funds.
     */
    INSUFFICIENT_FUNDS,

    /**
     * Resolve or chargeback on a transaction that is not under dispute.
     */
    NOT_DISPUTED,

    /**
     * Deposit or withdrawal on a locked account.
     */
    ACCOUNT_LOCKED,

    /**
     * Deposit or withdrawal reusing a tx id already in the history.
     */
    DUPLICATE_TRANSACTION
}
