package com.example.settlement.dto;

import com.example.settlement.model.Transaction;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw input row, {@code type, client, tx, amount}. Fields stay textual until
 * {@link #toTransaction()} validates them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"type", "client", "tx", "amount"})
public class TransactionRow {
    private String type;
    private String client;
    private String tx;
    private String amount;

    public Transaction toTransaction() {
        return Transaction.parse(type, client, tx, amount);
    }
}
