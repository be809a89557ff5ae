package com.flagship.transaction_ledger.observability;

import com.flagship.transaction_ledger.ledger.RejectionReason;
import com.flagship.transaction_ledger.record.TransactionKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralized metrics for ledger replays.
 *
 * Metrics exposed:
 * - ledger.transactions.applied: Counter of applied records, tagged by kind
 * - ledger.transactions.rejected: Counter of rejected records, tagged by kind and reason
 * - ledger.replay.duration: Timer for complete replay runs
 */
@Component
public class LedgerMetrics {

    static final String APPLIED = "ledger.transactions.applied";
    static final String REJECTED = "ledger.transactions.rejected";
    static final String REPLAY_DURATION = "ledger.replay.duration";

    private final MeterRegistry registry;
    private final Timer replayTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.replayTimer = Timer.builder(REPLAY_DURATION)
                .description("Time taken to replay a transaction stream")
                .register(registry);
    }

    public void recordApplied(TransactionKind kind) {
        Counter.builder(APPLIED)
                .description("Number of transaction records applied to the ledger")
                .tag("kind", kind.code())
                .register(registry)
                .increment();
    }

    public void recordRejected(TransactionKind kind, RejectionReason reason) {
        Counter.builder(REJECTED)
                .description("Number of transaction records rejected by the ledger")
                .tag("kind", kind.code())
                .tag("reason", reason.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordReplayDuration(Duration duration) {
        replayTimer.record(duration);
    }
}
