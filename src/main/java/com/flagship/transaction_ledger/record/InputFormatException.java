package com.flagship.transaction_ledger.record;

import lombok.Getter;

/**
 * Raised when the transaction input cannot be parsed into records.
 * The record number is 1-based and counts the header row; 0 means the header itself.
 */
@Getter
public class InputFormatException extends RuntimeException {

    private final long recordNumber;

    public InputFormatException(long recordNumber, String message) {
        super(String.format("Malformed input at record %d: %s", recordNumber, message));
        this.recordNumber = recordNumber;
    }

    public InputFormatException(long recordNumber, String message, Throwable cause) {
        super(String.format("Malformed input at record %d: %s", recordNumber, message), cause);
        this.recordNumber = recordNumber;
    }
}
