package com.example.settlement.dto;

import com.example.settlement.model.Account;
import com.example.settlement.model.Transaction;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"client", "available", "held", "total", "locked"})
public class AccountRow {
    private int client;
    private BigDecimal available;
    private BigDecimal held;
    private BigDecimal total;
    private boolean locked;

    public static AccountRow fromEntity(Account account) {
        return new AccountRow(
                account.getClientId(),
                scaled(account.getAvailable()),
                scaled(account.getHeld()),
                scaled(account.getTotal()),
                account.isLocked());
    }

    private static BigDecimal scaled(BigDecimal value) {
        return value.setScale(Transaction.AMOUNT_SCALE, RoundingMode.HALF_EVEN);
    }
}
