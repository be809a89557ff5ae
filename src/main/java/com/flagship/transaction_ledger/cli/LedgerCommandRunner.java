package com.flagship.transaction_ledger.cli;

import com.flagship.transaction_ledger.export.AccountCsvWriter;
import com.flagship.transaction_ledger.ledger.TransactionRejectedException;
import com.flagship.transaction_ledger.record.InputFormatException;
import com.flagship.transaction_ledger.record.TransactionCsvReader;
import com.flagship.transaction_ledger.replay.LedgerReplayService;
import com.flagship.transaction_ledger.replay.ReplaySummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point: {@code transaction-ledger <transactions.csv>}.
 *
 * Reads the CSV, replays it into the ledger and prints the final accounts to standard output.
 * Logs go to standard error. Nothing is printed to standard output unless the whole
 * replay succeeded.
 *
 * Failures map to {@link ExitStatus} codes, reported to Spring Boot through
 * {@link ExitCodeGenerator}.
 */
@Component
@ConditionalOnProperty(name = "ledger.runner.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LedgerCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private final LedgerReplayService replayService;
    private final AccountCsvWriter accountCsvWriter;

    private ExitStatus exitStatus = ExitStatus.SUCCESS;

    @Override
    public void run(ApplicationArguments args) {
        exitStatus = execute(args.getNonOptionArgs(), System.out);
    }

    @Override
    public int getExitCode() {
        return exitStatus.code();
    }

    /**
     * Runs one replay.
     *
     * @param arguments positional arguments; the first one is the input file
     * @param out sink for the account CSV, flushed but not closed
     * @return the exit status of the run
     */
    ExitStatus execute(List<String> arguments, OutputStream out) {
        if (arguments.isEmpty()) {
            log.error("Error, please provide a csv file path, example: transaction-ledger transactions.csv");
            return ExitStatus.USAGE;
        }

        String csvPath = arguments.get(0);
        try {
            ReplaySummary summary;
            try (TransactionCsvReader reader = TransactionCsvReader.open(Path.of(csvPath))) {
                summary = replayService.replay(reader);
            }

            Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            accountCsvWriter.write(summary.getAccounts(), writer);
            writer.flush();
            return ExitStatus.SUCCESS;

        } catch (IOException | InvalidPathException e) {
            log.error("I/O error while processing {}: {}", csvPath, e.toString());
            return ExitStatus.IO_FAILURE;
        } catch (InputFormatException e) {
            log.error("CSV error in {}: {}", csvPath, e.getMessage());
            return ExitStatus.INPUT_FORMAT;
        } catch (TransactionRejectedException e) {
            log.error("Transaction error: reason={}, {}", e.getReason(), e.getMessage());
            return ExitStatus.LEDGER_RULE;
        }
    }
}
