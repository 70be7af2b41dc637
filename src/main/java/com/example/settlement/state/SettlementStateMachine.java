package com.example.settlement.state;

import com.example.settlement.model.Account;
import com.example.settlement.model.ProcessedTransaction;
import com.example.settlement.model.Transaction;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies transactions to client accounts in the order they are received.
 *
 * <p>Each instance owns its accounts and the table of applied deposits and withdrawals;
 * one instance settles exactly one input stream. Not thread-safe.
 */
@Slf4j
public class SettlementStateMachine {

    // insertion order = order in which clients were first seen
    private final Map<Integer, Account> accounts = new LinkedHashMap<>();
    private final Map<Long, ProcessedTransaction> processedTransactions = new HashMap<>();

    public ProcessingOutcome apply(Transaction transaction) {
        Objects.requireNonNull(transaction, "transaction");

        ProcessingOutcome outcome = switch (transaction.getType()) {
            case DEPOSIT -> processDeposit(transaction);
            case WITHDRAWAL -> processWithdrawal(transaction);
            case DISPUTE -> processDispute(transaction);
            case RESOLVE -> processResolve(transaction);
            case CHARGEBACK -> processChargeback(transaction);
        };

        if (outcome.isRejected()) {
            log.debug("Rejected {} tx={} client={}: {}", transaction.getType().getValue(),
                    transaction.getTxId(), transaction.getClientId(), outcome.getRejectionReason());
        }
        return outcome;
    }

    /**
     * Accounts in the order their clients were first seen.
     */
    public List<Account> snapshot() {
        return new ArrayList<>(accounts.values());
    }

    public Optional<Account> getAccount(int clientId) {
        return Optional.ofNullable(accounts.get(clientId));
    }

    public Optional<ProcessedTransaction> getProcessedTransaction(long txId) {
        return Optional.ofNullable(processedTransactions.get(txId));
    }

    private ProcessingOutcome processDeposit(Transaction transaction) {
        Account account = accountFor(transaction.getClientId());
        if (processedTransactions.containsKey(transaction.getTxId())) {
            return ProcessingOutcome.rejected(RejectionReason.DUPLICATE_TRANSACTION);
        }
        if (account.isLocked()) {
            return ProcessingOutcome.rejected(RejectionReason.ACCOUNT_LOCKED);
        }

        account.credit(transaction.requireAmount());
        record(transaction);
        return ProcessingOutcome.APPLIED;
    }

    private ProcessingOutcome processWithdrawal(Transaction transaction) {
        Account account = accountFor(transaction.getClientId());
        if (processedTransactions.containsKey(transaction.getTxId())) {
            return ProcessingOutcome.rejected(RejectionReason.DUPLICATE_TRANSACTION);
        }
        if (account.isLocked()) {
            return ProcessingOutcome.rejected(RejectionReason.ACCOUNT_LOCKED);
        }
        BigDecimal amount = transaction.requireAmount();
        if (!account.hasAvailable(amount)) {
            return ProcessingOutcome.rejected(RejectionReason.INSUFFICIENT_FUNDS);
        }

        account.debit(amount);
        record(transaction);
        return ProcessingOutcome.APPLIED;
    }

    private ProcessingOutcome processDispute(Transaction transaction) {
        ProcessedTransaction original = processedTransactions.get(transaction.getRefTxId());
        RejectionReason problem = checkReference(transaction, original);
        if (problem != null) {
            return ProcessingOutcome.rejected(problem);
        }
        if (original.isDisputed()) {
            return ProcessingOutcome.rejected(RejectionReason.ALREADY_DISPUTED);
        }
        if (original.isChargedBack()) {
            return ProcessingOutcome.rejected(RejectionReason.ALREADY_CHARGED_BACK);
        }

        accounts.get(original.getClientId()).hold(original.getAmount());
        original.markDisputed();
        return ProcessingOutcome.APPLIED;
    }

    private ProcessingOutcome processResolve(Transaction transaction) {
        ProcessedTransaction original = processedTransactions.get(transaction.getRefTxId());
        RejectionReason problem = checkReference(transaction, original);
        if (problem != null) {
            return ProcessingOutcome.rejected(problem);
        }
        if (!original.isDisputed()) {
            return ProcessingOutcome.rejected(RejectionReason.NOT_DISPUTED);
        }

        accounts.get(original.getClientId()).release(original.getAmount());
        original.markResolved();
        return ProcessingOutcome.APPLIED;
    }

    private ProcessingOutcome processChargeback(Transaction transaction) {
        ProcessedTransaction original = processedTransactions.get(transaction.getRefTxId());
        RejectionReason problem = checkReference(transaction, original);
        if (problem != null) {
            return ProcessingOutcome.rejected(problem);
        }
        if (!original.isDisputed()) {
            return ProcessingOutcome.rejected(RejectionReason.NOT_DISPUTED);
        }

        Account account = accounts.get(original.getClientId());
        account.chargeBack(original.getAmount());
        original.markChargedBack();
        log.info("Chargeback of tx={} locked client {}", original.getTxId(), account.getClientId());
        return ProcessingOutcome.APPLIED;
    }

    private RejectionReason checkReference(Transaction transaction, ProcessedTransaction original) {
        if (original == null) {
            return RejectionReason.UNKNOWN_TRANSACTION;
        }
        if (original.getClientId() != transaction.getClientId()) {
            return RejectionReason.CLIENT_MISMATCH;
        }
        return null;
    }

    private Account accountFor(int clientId) {
        return accounts.computeIfAbsent(clientId, Account::new);
    }

    private void record(Transaction transaction) {
        processedTransactions.put(transaction.getTxId(), ProcessedTransaction.from(transaction));
    }
}
