package com.flagship.transaction_ledger.replay;

import com.flagship.transaction_ledger.ledger.Ledger;
import com.flagship.transaction_ledger.ledger.TransactionRejectedException;
import com.flagship.transaction_ledger.observability.LedgerMetrics;
import com.flagship.transaction_ledger.record.InputFormatException;
import com.flagship.transaction_ledger.record.TransactionRecord;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Feeds a stream of transaction records into a fresh {@link Ledger}.
 *
 * Records are applied strictly in stream order, one at a time. Rejections are handled
 * according to the configured {@link ErrorPolicy} ({@code ledger.replay.error-policy},
 * HALT by default). Malformed input always aborts the replay.
 */
@Service
@Slf4j
public class LedgerReplayService {

    static final String CLIENT_MDC_KEY = "client";
    static final String TX_MDC_KEY = "tx";

    private final LedgerMetrics ledgerMetrics;
    private final ErrorPolicy errorPolicy;

    public LedgerReplayService(LedgerMetrics ledgerMetrics,
                               @Value("${ledger.replay.error-policy:HALT}") ErrorPolicy errorPolicy) {
        this.ledgerMetrics = ledgerMetrics;
        this.errorPolicy = errorPolicy;
    }

    /**
     * Replays all records and returns the final account state.
     *
     * @param records records in input order
     * @return final balances and record counts
     * @throws TransactionRejectedException on the first rejection when the policy is HALT
     * @throws InputFormatException if the record source hits a malformed row
     */
    public ReplaySummary replay(Iterable<TransactionRecord> records) {
        long startTime = System.currentTimeMillis();
        Ledger ledger = new Ledger();
        long applied = 0;
        long rejected = 0;

        log.info("Starting ledger replay: errorPolicy={}", errorPolicy);

        try {
            for (TransactionRecord record : records) {
                if (applyRecord(ledger, record)) {
                    applied++;
                } else {
                    rejected++;
                }
            }
        } catch (TransactionRejectedException | InputFormatException e) {
            log.error("Ledger replay aborted after {} records: {}", applied + rejected, e.getMessage());
            throw e;
        } finally {
            ledgerMetrics.recordReplayDuration(Duration.ofMillis(System.currentTimeMillis() - startTime));
        }

        log.info("Ledger replay completed: applied={}, rejected={}, accounts={}, duration={}ms",
                applied, rejected, ledger.accountCount(), System.currentTimeMillis() - startTime);

        return new ReplaySummary(ledger.export(), applied, rejected);
    }

    /**
     * @return true if applied, false if rejected and skipped
     */
    private boolean applyRecord(Ledger ledger, TransactionRecord record) {
        MDC.put(CLIENT_MDC_KEY, String.valueOf(record.getClient()));
        MDC.put(TX_MDC_KEY, String.valueOf(record.getTx()));
        try {
            log.debug("Processing tx: {}", record);
            ledger.apply(record);
            ledgerMetrics.recordApplied(record.getKind());
            return true;
        } catch (TransactionRejectedException e) {
            ledgerMetrics.recordRejected(e.getKind(), e.getReason());
            if (errorPolicy == ErrorPolicy.HALT) {
                throw e;
            }
            log.warn("Skipping rejected {}: reason={}, message={}", record.getKind().code(), e.getReason(), e.getMessage());
            return false;
        } finally {
            MDC.remove(CLIENT_MDC_KEY);
            MDC.remove(TX_MDC_KEY);
        }
    }
}
