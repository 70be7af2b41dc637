package com.example.settlement.service;

/**
 * What to do with an input row that is not a valid transaction.
 */
public enum MalformedRecordPolicy {
    /** Fail the whole run; nothing is written. */
    ABORT,
    /** Log the row, count it and continue with the next one. */
    SKIP
}
