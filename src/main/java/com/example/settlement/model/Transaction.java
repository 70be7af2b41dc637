package com.example.settlement.model;

import com.example.settlement.exception.MalformedRecordException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.ToString;
import lombok.Value;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * One validated input event.
 *
 * <p>For deposits and withdrawals {@code txId} is the transaction's own id. For disputes,
 * resolves and chargebacks it is the id of the deposit or withdrawal being referenced,
 * see {@link #getRefTxId()}.
 */
@Value
@ToString(doNotUseGetters = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Transaction {

    public static final int MAX_CLIENT_ID = 0xFFFF;
    public static final long MAX_TX_ID = 0xFFFF_FFFFL;
    public static final int AMOUNT_SCALE = 4;
    public static final int AMOUNT_PRECISION = 28;

    TransactionType type;
    int clientId;
    long txId;
    BigDecimal amount;

    public static Transaction deposit(int clientId, long txId, BigDecimal amount) {
        return of(TransactionType.DEPOSIT, clientId, txId, amount);
    }

    public static Transaction withdrawal(int clientId, long txId, BigDecimal amount) {
        return of(TransactionType.WITHDRAWAL, clientId, txId, amount);
    }

    public static Transaction dispute(int clientId, long refTxId) {
        return of(TransactionType.DISPUTE, clientId, refTxId, null);
    }

    public static Transaction resolve(int clientId, long refTxId) {
        return of(TransactionType.RESOLVE, clientId, refTxId, null);
    }

    public static Transaction chargeback(int clientId, long refTxId) {
        return of(TransactionType.CHARGEBACK, clientId, refTxId, null);
    }

    /**
     * Builds a record, enforcing the amount rules for the given type.
     *
     * @throws MalformedRecordException when any field is out of range or the amount
     *                                  does not match the transaction type
     */
    public static Transaction of(TransactionType type, long clientId, long txId, BigDecimal amount) {
        if (type == null) {
            throw new MalformedRecordException("Transaction type is required");
        }
        if (clientId < 0 || clientId > MAX_CLIENT_ID) {
            throw new MalformedRecordException("Client id out of range: " + clientId);
        }
        if (txId < 0 || txId > MAX_TX_ID) {
            throw new MalformedRecordException("Transaction id out of range: " + txId);
        }
        if (type.carriesAmount()) {
            if (amount == null) {
                throw new MalformedRecordException("Amount is required for " + type.getValue() + " " + txId);
            }
            if (amount.signum() < 0) {
                throw new MalformedRecordException("Amount must not be negative: " + amount);
            }
            BigDecimal normalized = amount.stripTrailingZeros();
            if (normalized.scale() > AMOUNT_SCALE) {
                throw new MalformedRecordException(
                        "Amount has more than " + AMOUNT_SCALE + " decimal places: " + amount);
            }
            // long: the scale of an extreme exponent is near Integer.MIN_VALUE
            long integerDigits = (long) normalized.precision() - normalized.scale();
            if (integerDigits > AMOUNT_PRECISION - AMOUNT_SCALE) {
                throw new MalformedRecordException("Amount too large: " + amount);
            }
        } else if (amount != null) {
            throw new MalformedRecordException("Amount is not allowed for " + type.getValue() + " " + txId);
        }
        return new Transaction(type, (int) clientId, txId, amount);
    }

    /**
     * Parses the raw textual fields of one input row.
     */
    public static Transaction parse(String type, String client, String tx, String amount) {
        TransactionType transactionType = TransactionType.fromValue(type);
        long clientId = parseId("client", client);
        long txId = parseId("tx", tx);
        BigDecimal parsedAmount = null;
        if (StringUtils.hasText(amount)) {
            try {
                parsedAmount = new BigDecimal(amount.trim());
            } catch (NumberFormatException e) {
                throw new MalformedRecordException("Amount is not a decimal number: " + amount, e);
            }
        }
        return of(transactionType, clientId, txId, parsedAmount);
    }

    private static long parseId(String field, String value) {
        if (!StringUtils.hasText(value)) {
            throw new MalformedRecordException("Missing " + field + " id");
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new MalformedRecordException("Invalid " + field + " id: " + value, e);
        }
    }

    public long getRefTxId() {
        return txId;
    }

    public Optional<BigDecimal> getAmount() {
        return Optional.ofNullable(amount);
    }

    /**
     * Amount of a deposit or withdrawal.
     */
    public BigDecimal requireAmount() {
        if (amount == null) {
            throw new IllegalStateException(type.getValue() + " " + txId + " carries no amount");
        }
        return amount;
    }
}
