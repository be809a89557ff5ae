package com.flagship.transaction_ledger.record;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.input.BOMInputStream;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Lazy, forward-only source of {@link TransactionRecord}s read from CSV.
 *
 * Expected layout:
 * <pre>
 * type, client, tx, amount
 * deposit, 1, 1, 1.0
 * dispute, 1, 1,
 * </pre>
 * Header names are matched ignoring case; every field is trimmed. The amount column
 * may be empty or missing altogether for disputes, resolves and chargebacks. An amount
 * that is not a decimal number is read as no amount and left to the ledger to reject.
 *
 * Iteration throws {@link InputFormatException} on the first malformed row. The reader
 * can only be iterated once.
 */
@Slf4j
public class TransactionCsvReader implements Iterable<TransactionRecord>, Closeable {

    static final String TYPE_COLUMN = "type";
    static final String CLIENT_COLUMN = "client";
    static final String TX_COLUMN = "tx";
    static final String AMOUNT_COLUMN = "amount";

    private static final List<String> REQUIRED_COLUMNS = List.of(TYPE_COLUMN, CLIENT_COLUMN, TX_COLUMN);

    private static final Pattern ID = Pattern.compile("\\+?[0-9]+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreHeaderCase(true)
            .setAllowMissingColumnNames(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();

    private final CSVParser parser;
    private final boolean empty;
    private boolean iterated;

    public TransactionCsvReader(Reader reader) throws IOException {
        this.parser = parseHeader(reader);
        Map<String, Integer> headers = parser.getHeaderMap();
        this.empty = headers == null || headers.isEmpty();
        if (!empty) {
            Set<String> columns = headers.keySet().stream()
                    .map(name -> name.toLowerCase(Locale.ROOT))
                    .collect(Collectors.toSet());
            for (String column : REQUIRED_COLUMNS) {
                if (!columns.contains(column)) {
                    parser.close();
                    throw new InputFormatException(0, "Missing required column '" + column + "' in header " + headers.keySet());
                }
            }
        }
    }

    /**
     * Opens a UTF-8 encoded CSV file. A leading byte order mark is skipped.
     *
     * @throws IOException if the file cannot be opened
     * @throws InputFormatException if the header row is malformed
     */
    public static TransactionCsvReader open(Path path) throws IOException {
        log.debug("Opening transaction file {}", path);
        InputStream in = BOMInputStream.builder()
                .setPath(path)
                .get();
        return new TransactionCsvReader(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8.newDecoder())));
    }

    private static CSVParser parseHeader(Reader reader) throws IOException {
        try {
            return new CSVParser(reader, FORMAT);
        } catch (IllegalArgumentException | IOException e) {
            // duplicate header names or a CSV syntax error in the header row
            reader.close();
            throw new InputFormatException(0, e.getMessage(), e);
        }
    }

    @Override
    public Iterator<TransactionRecord> iterator() {
        if (iterated) {
            throw new IllegalStateException("Transaction records can only be iterated once");
        }
        iterated = true;
        if (empty) {
            log.warn("Transaction input is empty, no records to read");
            return Collections.emptyIterator();
        }
        return new RecordIterator(parser.iterator());
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }

    static TransactionRecord toTransactionRecord(CSVRecord csvRecord) {
        long recordNumber = csvRecord.getRecordNumber();
        try {
            TransactionKind kind = TransactionKind.fromCode(requiredField(csvRecord, TYPE_COLUMN));
            int client = parseClient(requiredField(csvRecord, CLIENT_COLUMN));
            long tx = parseTx(requiredField(csvRecord, TX_COLUMN));
            Double amount = parseAmount(csvRecord);
            return TransactionRecord.of(kind, client, tx, amount);
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            throw new InputFormatException(recordNumber, e.getMessage(), e);
        }
    }

    private static String requiredField(CSVRecord csvRecord, String column) {
        String value = csvRecord.isSet(column) ? csvRecord.get(column) : null;
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Missing value for column '" + column + "'");
        }
        return value;
    }

    private static int parseClient(String value) {
        int client = Integer.parseInt(requireId(value, "Client"));
        if (client < 0 || client > TransactionRecord.MAX_CLIENT_ID) {
            throw new IllegalArgumentException("Client id out of range: " + value);
        }
        return client;
    }

    private static long parseTx(String value) {
        long tx = Long.parseLong(requireId(value, "Transaction"));
        if (tx < 0 || tx > TransactionRecord.MAX_TX_ID) {
            throw new IllegalArgumentException("Transaction id out of range: " + value);
        }
        return tx;
    }

    private static String requireId(String value, String label) {
        if (!ID.matcher(value).matches()) {
            throw new IllegalArgumentException(label + " id is not an unsigned integer: " + value);
        }
        return value;
    }

    private static Double parseAmount(CSVRecord csvRecord) {
        if (!csvRecord.isSet(AMOUNT_COLUMN)) {
            return null;
        }
        String value = csvRecord.get(AMOUNT_COLUMN);
        if (value == null || value.isEmpty()) {
            return null;
        }
        Double amount = parseDecimal(value);
        if (amount == null) {
            log.debug("Ignoring unparseable amount '{}' in record {}", value, csvRecord.getRecordNumber());
        }
        return amount;
    }

    /**
     * Plain or exponent decimal notation, or inf/infinity/nan in any case with an optional sign.
     * Java-only literals such as {@code 1d} or {@code 0x1p3} are not numbers here.
     *
     * @return the value, or null if the text is not a number
     */
    static Double parseDecimal(String value) {
        if (DECIMAL.matcher(value).matches()) {
            return Double.valueOf(value);
        }
        String word = value.toLowerCase(Locale.ROOT);
        boolean negative = word.startsWith("-");
        if (negative || word.startsWith("+")) {
            word = word.substring(1);
        }
        switch (word) {
            case "nan":
                return Double.NaN;
            case "inf":
            case "infinity":
                return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            default:
                return null;
        }
    }

    private static final class RecordIterator implements Iterator<TransactionRecord> {

        private final Iterator<CSVRecord> delegate;
        private long lastRecordNumber;

        private RecordIterator(Iterator<CSVRecord> delegate) {
            this.delegate = delegate;
        }

        @Override
        public boolean hasNext() {
            try {
                return delegate.hasNext();
            } catch (UncheckedIOException e) {
                throw new InputFormatException(lastRecordNumber + 1, e.getMessage(), e);
            }
        }

        @Override
        public TransactionRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            CSVRecord csvRecord = delegate.next();
            lastRecordNumber = csvRecord.getRecordNumber();
            return toTransactionRecord(csvRecord);
        }
    }
}
