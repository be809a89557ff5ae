package com.flagship.transaction_ledger.cli;

/**
 * Process exit codes of the ledger command.
 */
public enum ExitStatus {
    SUCCESS(0),
    USAGE(1),
    IO_FAILURE(2),
    INPUT_FORMAT(3),
    LEDGER_RULE(4);

    private final int code;

    ExitStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
