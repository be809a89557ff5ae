package com.flagship.transaction_ledger.export;

import com.flagship.transaction_ledger.ledger.AccountSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Writes final account balances as CSV.
 *
 * Output layout:
 * <pre>
 * client,available,held,total,locked
 * 1,1.5,0.0,1.5,false
 * </pre>
 * Amounts are rendered with {@link AmountFormat}. The sink is flushed but never closed,
 * so standard output can be passed in directly.
 */
@Component
@Slf4j
public class AccountCsvWriter {

    static final String[] HEADER = {"client", "available", "held", "total", "locked"};

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(HEADER)
            .setRecordSeparator('\n')
            .build();

    public void write(List<AccountSnapshot> accounts, Appendable out) throws IOException {
        CSVPrinter printer = new CSVPrinter(out, FORMAT);
        for (AccountSnapshot account : accounts) {
            printer.printRecord(
                account.getClient(),
                AmountFormat.render(account.getAvailable()),
                AmountFormat.render(account.getHeld()),
                AmountFormat.render(account.getTotal()),
                account.isLocked()
            );
        }
        printer.flush();
        log.debug("Wrote {} account rows", accounts.size());
    }
}
