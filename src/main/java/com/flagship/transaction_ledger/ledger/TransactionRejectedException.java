package com.flagship.transaction_ledger.ledger;

import com.flagship.transaction_ledger.record.TransactionKind;
import com.flagship.transaction_ledger.record.TransactionRecord;
import lombok.Getter;

/**
 * Thrown by {@link Ledger#apply(TransactionRecord)} when a record breaks a ledger rule.
 * The caller decides whether to halt or to skip the record and continue.
 */
@Getter
public class TransactionRejectedException extends RuntimeException {

    private final RejectionReason reason;
    private final TransactionKind kind;
    private final int client;
    private final long tx;

    TransactionRejectedException(RejectionReason reason, TransactionRecord record, String message) {
        super(message);
        this.reason = reason;
        this.kind = record.getKind();
        this.client = record.getClient();
        this.tx = record.getTx();
    }

    static TransactionRejectedException unknownClient(TransactionRecord record) {
        return new TransactionRejectedException(RejectionReason.UNKNOWN_CLIENT, record,
            String.format("Unknown client (client id: %d)", record.getClient()));
    }

    static TransactionRejectedException unknownTransaction(TransactionRecord record) {
        return new TransactionRejectedException(RejectionReason.UNKNOWN_TRANSACTION, record,
            String.format("Unknown transaction (tx: %d)", record.getTx()));
    }

    static TransactionRejectedException invalidAmount(TransactionRecord record) {
        return new TransactionRejectedException(RejectionReason.INVALID_AMOUNT, record,
            String.format("Invalid amount for %s tx %d: %s", record.getKind().code(), record.getTx(), record.getAmount()));
    }

    static TransactionRejectedException amountOverflow(TransactionRecord record) {
        return new TransactionRejectedException(RejectionReason.AMOUNT_OVERFLOW, record,
            String.format("Account amount is too large (client id: %d, tx: %d)", record.getClient(), record.getTx()));
    }

    static TransactionRejectedException insufficientFunds(TransactionRecord record, double available) {
        return new TransactionRejectedException(RejectionReason.INSUFFICIENT_FUNDS, record,
            String.format("Insufficient funds for withdrawal tx %d: requested=%s, available=%s",
                record.getTx(), record.getAmount(), available));
    }

    static TransactionRejectedException notDisputed(TransactionRecord record) {
        return new TransactionRejectedException(RejectionReason.NOT_DISPUTED, record,
            String.format("Transaction %d is not disputed", record.getTx()));
    }

    static TransactionRejectedException accountLocked(TransactionRecord record) {
        return new TransactionRejectedException(RejectionReason.ACCOUNT_LOCKED, record,
            String.format("Account (client id: %d) is locked", record.getClient()));
    }

    static TransactionRejectedException duplicateTransaction(TransactionRecord record) {
        return new TransactionRejectedException(RejectionReason.DUPLICATE_TRANSACTION, record,
            String.format("Invalid or non unique transaction (tx: %d)", record.getTx()));
    }
}
