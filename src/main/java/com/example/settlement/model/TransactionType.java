package com.example.settlement.model;

import com.example.settlement.exception.MalformedRecordException;

import java.util.Locale;

public enum TransactionType {
    DEPOSIT("deposit"),
    WITHDRAWAL("withdrawal"),
    DISPUTE("dispute"),
    RESOLVE("resolve"),
    CHARGEBACK("chargeback");

    private final String value;

    TransactionType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Deposits and withdrawals carry their own amount; the other kinds reference one.
     */
    public boolean carriesAmount() {
        return this == DEPOSIT || this == WITHDRAWAL;
    }

    public static TransactionType fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (TransactionType type : TransactionType.values()) {
                if (type.value.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new MalformedRecordException("Unknown transaction type: " + value);
    }
}
