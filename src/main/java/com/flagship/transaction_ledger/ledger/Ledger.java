package com.flagship.transaction_ledger.ledger;

import com.flagship.transaction_ledger.record.TransactionRecord;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Client accounts and the deposit/withdrawal history of one replay run.
 *
 * This class enforces the ledger rules:
 * 1. tx ids of deposits and withdrawals are unique across all clients
 * 2. Amounts must be finite and positive
 * 3. Locked accounts accept no further deposits or withdrawals
 * 4. Resolve and chargeback require an active dispute
 *
 * Every {@link #apply(TransactionRecord)} call either fully succeeds or throws
 * {@link TransactionRejectedException}. The one exception is {@link RejectionReason#AMOUNT_OVERFLOW},
 * which is detected after the deposit has already been added to the account.
 *
 * Not thread-safe; records are applied strictly one after another.
 */
public class Ledger {

    private final Map<Integer, Account> accounts = new TreeMap<>();
    private final Map<Long, TransactionHistoryEntry> history = new HashMap<>();

    /**
     * Applies a single transaction record.
     *
     * The account of {@code record.getClient()} is created before any validation,
     * so even a rejected record leaves a (zeroed) account behind.
     *
     * @param record the record to apply
     * @throws TransactionRejectedException if the record breaks a ledger rule
     */
    public void apply(TransactionRecord record) {
        accounts.computeIfAbsent(record.getClient(), Account::new);

        switch (record.getKind()) {
            case DEPOSIT -> deposit(record);
            case WITHDRAWAL -> withdraw(record);
            case DISPUTE -> dispute(record);
            case RESOLVE -> resolve(record);
            case CHARGEBACK -> chargeBack(record);
        }
    }

    /**
     * Snapshots of all known accounts, ordered by client id.
     */
    public List<AccountSnapshot> export() {
        return accounts.values().stream()
            .map(Account::snapshot)
            .collect(Collectors.toList());
    }

    public Optional<AccountSnapshot> findAccount(int client) {
        return Optional.ofNullable(accounts.get(client)).map(Account::snapshot);
    }

    public Optional<TransactionHistoryEntry> findHistoryEntry(long tx) {
        return Optional.ofNullable(history.get(tx));
    }

    /**
     * Whether the deposit or withdrawal {@code tx} is currently under dispute.
     * False for unknown transactions.
     */
    public boolean isUnderDispute(long tx) {
        TransactionHistoryEntry entry = history.get(tx);
        return entry != null && entry.isUnderDispute();
    }

    public int accountCount() {
        return accounts.size();
    }

    public int historySize() {
        return history.size();
    }

    private void deposit(TransactionRecord record) {
        double amount = validateFundsMovement(record);
        Account account = requireAccount(record);

        double previousAvailable = account.getAvailable();
        double previousTotal = account.getTotal();
        account.credit(amount);

        // An absorbed addition means the balance can no longer grow by this amount.
        // The account keeps whatever the addition produced; the deposit is not recorded.
        if (account.getAvailable() == previousAvailable || account.getTotal() == previousTotal) {
            throw TransactionRejectedException.amountOverflow(record);
        }

        history.put(record.getTx(), new TransactionHistoryEntry(record));
    }

    private void withdraw(TransactionRecord record) {
        double amount = validateFundsMovement(record);
        Account account = requireAccount(record);

        if (amount > account.getAvailable()) {
            throw TransactionRejectedException.insufficientFunds(record, account.getAvailable());
        }
        account.debit(amount);

        history.put(record.getTx(), new TransactionHistoryEntry(record));
    }

    private void dispute(TransactionRecord record) {
        TransactionHistoryEntry entry = requireHistoryEntry(record);
        Account account = requireAccount(record);

        account.hold(entry.getAmount());
        entry.markDisputed();
    }

    private void resolve(TransactionRecord record) {
        TransactionHistoryEntry entry = requireDisputedEntry(record);
        Account account = requireAccount(record);

        account.release(entry.getAmount());
        entry.clearDispute();
    }

    private void chargeBack(TransactionRecord record) {
        TransactionHistoryEntry entry = requireDisputedEntry(record);
        Account account = requireAccount(record);

        account.chargeBack(entry.getAmount());
        entry.clearDispute();
    }

    /**
     * Checks shared by deposits and withdrawals, in rejection order:
     * duplicate tx, invalid amount, locked account.
     *
     * @return the validated amount
     */
    private double validateFundsMovement(TransactionRecord record) {
        if (history.containsKey(record.getTx())) {
            throw TransactionRejectedException.duplicateTransaction(record);
        }

        Double amount = record.getAmount();
        // NaN fails the comparison as well
        if (amount == null || !Double.isFinite(amount) || !(amount > 0.0)) {
            throw TransactionRejectedException.invalidAmount(record);
        }

        if (requireAccount(record).isLocked()) {
            throw TransactionRejectedException.accountLocked(record);
        }
        return amount;
    }

    private Account requireAccount(TransactionRecord record) {
        Account account = accounts.get(record.getClient());
        if (account == null) {
            throw TransactionRejectedException.unknownClient(record);
        }
        return account;
    }

    private TransactionHistoryEntry requireHistoryEntry(TransactionRecord record) {
        TransactionHistoryEntry entry = history.get(record.getTx());
        if (entry == null) {
            throw TransactionRejectedException.unknownTransaction(record);
        }
        return entry;
    }

    private TransactionHistoryEntry requireDisputedEntry(TransactionRecord record) {
        TransactionHistoryEntry entry = requireHistoryEntry(record);
        if (!entry.isUnderDispute()) {
            throw TransactionRejectedException.notDisputed(record);
        }
        return entry;
    }
}
