package com.example.settlement.model;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * A deposit or withdrawal that has been applied, kept so that later disputes,
 * resolves and chargebacks can find its client and amount.
 */
@Getter
@ToString
public class ProcessedTransaction {

    private final long txId;
    private final int clientId;
    private final TransactionType type;
    private final BigDecimal amount;
    private DisputeState disputeState = DisputeState.NONE;

    public ProcessedTransaction(long txId, int clientId, TransactionType type, BigDecimal amount) {
        this.txId = txId;
        this.clientId = clientId;
        this.type = type;
        this.amount = amount;
    }

    public static ProcessedTransaction from(Transaction transaction) {
        return new ProcessedTransaction(transaction.getTxId(), transaction.getClientId(),
                transaction.getType(), transaction.requireAmount());
    }

    public boolean isDisputed() {
        return disputeState == DisputeState.DISPUTED;
    }

    public boolean isChargedBack() {
        return disputeState == DisputeState.CHARGED_BACK;
    }

    public void markDisputed() {
        transition(DisputeState.NONE, DisputeState.DISPUTED);
    }

    public void markResolved() {
        transition(DisputeState.DISPUTED, DisputeState.NONE);
    }

    public void markChargedBack() {
        transition(DisputeState.DISPUTED, DisputeState.CHARGED_BACK);
    }

    private void transition(DisputeState expected, DisputeState next) {
        if (disputeState != expected) {
            throw new IllegalStateException(
                    "Transaction " + txId + " is " + disputeState + ", expected " + expected);
        }
        disputeState = next;
    }

    // 争议状态
    public enum DisputeState {
        NONE,
        DISPUTED,
        CHARGED_BACK
    }
}
