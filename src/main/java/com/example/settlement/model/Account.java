package com.example.settlement.model;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Balance state of one client. {@code total} is always {@code available + held}.
 */
@Getter
@ToString
public class Account {

    private final int clientId;
    private BigDecimal available = BigDecimal.ZERO;
    private BigDecimal held = BigDecimal.ZERO;
    private boolean locked;

    public Account(int clientId) {
        this.clientId = clientId;
    }

    @ToString.Include
    public BigDecimal getTotal() {
        return available.add(held);
    }

    public boolean hasAvailable(BigDecimal amount) {
        return available.compareTo(amount) >= 0;
    }

    public void credit(BigDecimal amount) {
        available = available.add(amount);
    }

    public void debit(BigDecimal amount) {
        available = available.subtract(amount);
    }

    // available -> held
    public void hold(BigDecimal amount) {
        available = available.subtract(amount);
        held = held.add(amount);
    }

    // held -> available
    public void release(BigDecimal amount) {
        held = held.subtract(amount);
        available = available.add(amount);
    }

    /**
     * Removes held funds permanently and freezes the account.
     */
    public void chargeBack(BigDecimal amount) {
        held = held.subtract(amount);
        locked = true;
    }
}
