package com.example.settlement.state;

public enum RejectionReason {
    /** Deposit or withdrawal reusing the id of an already applied one. */
    DUPLICATE_TRANSACTION,
    ACCOUNT_LOCKED,
    INSUFFICIENT_FUNDS,
    /** Referenced transaction was never applied. */
    UNKNOWN_TRANSACTION,
    /** Referenced transaction belongs to another client. */
    CLIENT_MISMATCH,
    ALREADY_DISPUTED,
    ALREADY_CHARGED_BACK,
    NOT_DISPUTED
}
