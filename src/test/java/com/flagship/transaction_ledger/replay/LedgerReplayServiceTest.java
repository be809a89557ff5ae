package com.flagship.transaction_ledger.replay;

import com.flagship.transaction_ledger.ledger.AccountSnapshot;
import com.flagship.transaction_ledger.ledger.RejectionReason;
import com.flagship.transaction_ledger.ledger.TransactionRejectedException;
import com.flagship.transaction_ledger.observability.LedgerMetrics;
import com.flagship.transaction_ledger.record.InputFormatException;
import com.flagship.transaction_ledger.record.TransactionCsvReader;
import com.flagship.transaction_ledger.record.TransactionRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Replay tests: end-to-end scenarios through the replay service and both error policies.
 */
class LedgerReplayServiceTest {

    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
    }

    private LedgerReplayService service(ErrorPolicy errorPolicy) {
        return new LedgerReplayService(new LedgerMetrics(registry), errorPolicy);
    }

    private double counter(String name, String... tags) {
        return registry.get(name).tags(tags).counter().count();
    }

    @Test
    @DisplayName("Deposit then withdrawal leaves the difference available")
    void testDepositThenWithdrawal() {
        ReplaySummary summary = service(ErrorPolicy.HALT).replay(List.of(
            TransactionRecord.deposit(1, 1, 25.11),
            TransactionRecord.withdrawal(1, 2, 25.0)
        ));

        AccountSnapshot account = summary.getAccounts().get(0);
        assertEquals(25.11 - 25.0, account.getAvailable());
        assertEquals(0.0, account.getHeld());
        assertEquals(25.11 - 25.0, account.getTotal());
        assertEquals(2, summary.getApplied());
        assertEquals(0, summary.getRejected());
        assertEquals(1.0, counter("ledger.transactions.applied", "kind", "deposit"));
        assertEquals(1.0, counter("ledger.transactions.applied", "kind", "withdrawal"));
    }

    @Test
    @DisplayName("HALT policy propagates the first rejection")
    void testHaltPolicy_ShouldFail() {
        LedgerReplayService service = service(ErrorPolicy.HALT);
        List<TransactionRecord> records = List.of(
            TransactionRecord.deposit(1, 1, 25.11),
            TransactionRecord.resolve(1, 1),
            TransactionRecord.deposit(1, 2, 1.0)
        );

        TransactionRejectedException exception = assertThrows(TransactionRejectedException.class,
            () -> service.replay(records));

        assertEquals(RejectionReason.NOT_DISPUTED, exception.getReason());
        assertEquals(1.0, counter("ledger.transactions.rejected", "kind", "resolve", "reason", "not_disputed"));
        assertEquals(1.0, counter("ledger.transactions.applied", "kind", "deposit"),
            "Records after the rejection must not be applied");
        assertEquals(1, registry.get("ledger.replay.duration").timer().count());
    }

    @Test
    @DisplayName("SKIP policy counts rejections and continues")
    void testSkipPolicy() {
        ReplaySummary summary = service(ErrorPolicy.SKIP).replay(List.of(
            TransactionRecord.deposit(1, 1, 2.5),
            TransactionRecord.resolve(1, 1),
            TransactionRecord.withdrawal(1, 2, 100.0),
            TransactionRecord.deposit(1, 3, 1.0)
        ));

        assertEquals(2, summary.getApplied());
        assertEquals(2, summary.getRejected());
        assertEquals(4, summary.getProcessed());
        assertEquals(List.of(new AccountSnapshot(1, 3.5, 0.0, 3.5, false)), summary.getAccounts());
        assertEquals(1.0, counter("ledger.transactions.rejected", "kind", "withdrawal", "reason", "insufficient_funds"));
    }

    @Test
    @DisplayName("Chargeback locks the account and a later deposit fails")
    void testChargebackThenDeposit_ShouldFail() {
        LedgerReplayService service = service(ErrorPolicy.SKIP);
        ReplaySummary summary = service.replay(List.of(
            TransactionRecord.deposit(1, 1, 25.11),
            TransactionRecord.dispute(1, 1),
            TransactionRecord.chargeback(1, 1),
            TransactionRecord.deposit(1, 2, 25.11)
        ));

        assertEquals(List.of(new AccountSnapshot(1, 0.0, 0.0, 0.0, true)), summary.getAccounts());
        assertEquals(1, summary.getRejected());
        assertEquals(1.0, counter("ledger.transactions.rejected", "kind", "deposit", "reason", "account_locked"));
    }

    @Test
    @DisplayName("Malformed input aborts the replay even with SKIP policy")
    void testMalformedInput_ShouldFail() throws IOException {
        LedgerReplayService service = service(ErrorPolicy.SKIP);
        try (TransactionCsvReader reader = new TransactionCsvReader(new StringReader(
                "type,client,tx,amount\ndeposit,1,1,1.0\ndeposit,x,2,1.0\n"))) {

            assertThrows(InputFormatException.class, () -> service.replay(reader));
        }
        assertEquals(1.0, counter("ledger.transactions.applied", "kind", "deposit"));
    }

    @Test
    @DisplayName("Each replay starts from an empty ledger")
    void testReplaysAreIndependent() {
        LedgerReplayService service = service(ErrorPolicy.HALT);
        service.replay(List.of(TransactionRecord.deposit(1, 1, 5.0)));

        ReplaySummary second = service.replay(List.of(TransactionRecord.deposit(2, 1, 7.0)));

        assertEquals(List.of(new AccountSnapshot(2, 7.0, 0.0, 7.0, false)), second.getAccounts());
    }
}
