package com.flagship.transaction_ledger;

import com.flagship.transaction_ledger.cli.LedgerCommandRunner;
import com.flagship.transaction_ledger.export.AccountCsvWriter;
import com.flagship.transaction_ledger.observability.LedgerMetrics;
import com.flagship.transaction_ledger.record.TransactionRecord;
import com.flagship.transaction_ledger.replay.LedgerReplayService;
import com.flagship.transaction_ledger.replay.ReplaySummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Context wiring with the command runner switched off.
 */
@SpringBootTest(properties = {
    "ledger.runner.enabled=false",
    "ledger.replay.error-policy=SKIP"
})
class TransactionLedgerApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private LedgerReplayService replayService;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    void contextLoads() {
        assertNotNull(context.getBean(AccountCsvWriter.class));
        assertNotNull(context.getBean(LedgerMetrics.class));
        assertTrue(context.getBeansOfType(LedgerCommandRunner.class).isEmpty());
    }

    @Test
    void errorPolicyIsBoundFromProperties() {
        ReplaySummary summary = replayService.replay(List.of(
            TransactionRecord.withdrawal(1, 1, 5.0),
            TransactionRecord.deposit(1, 2, 5.0)
        ));

        assertEquals(1, summary.getApplied());
        assertEquals(1, summary.getRejected());
        assertNotNull(meterRegistry.find("ledger.transactions.rejected").counter());
    }
}
