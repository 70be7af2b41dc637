package com.example.settlement.exception;

import lombok.Getter;

/**
 * An input row that cannot be turned into a valid transaction record.
 */
@Getter
public class MalformedRecordException extends RuntimeException {

    /** 1-based data record number, or 0 when the row position is not known. */
    private final long recordNumber;

    public MalformedRecordException(String message) {
        this(message, 0, null);
    }

    public MalformedRecordException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    private MalformedRecordException(String message, long recordNumber, Throwable cause) {
        super(message, cause);
        this.recordNumber = recordNumber;
    }

    public MalformedRecordException atRecord(long recordNumber) {
        return new MalformedRecordException("Record #" + recordNumber + ": " + getMessage(), recordNumber, this);
    }
}
