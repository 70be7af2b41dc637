package com.example.settlement.service;

import com.example.settlement.csv.AccountCsvWriter;
import com.example.settlement.csv.TransactionCsvReader;
import com.example.settlement.dto.TransactionRow;
import com.example.settlement.exception.MalformedRecordException;
import com.example.settlement.model.Account;
import com.example.settlement.model.Transaction;
import com.example.settlement.state.SettlementStateMachine;
import com.fasterxml.jackson.databind.MappingIterator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Slf4j
@Service
public class SettlementService {

    private final TransactionCsvReader transactionCsvReader;
    private final AccountCsvWriter accountCsvWriter;
    private final MalformedRecordPolicy malformedRecordPolicy;

    public SettlementService(TransactionCsvReader transactionCsvReader,
                             AccountCsvWriter accountCsvWriter,
                             @Value("${settlement.malformed-record-policy:ABORT}") MalformedRecordPolicy malformedRecordPolicy) {
        this.transactionCsvReader = transactionCsvReader;
        this.accountCsvWriter = accountCsvWriter;
        this.malformedRecordPolicy = malformedRecordPolicy;
        log.info("SettlementService initialized, malformed records: {}", malformedRecordPolicy);
    }

    /**
     * Settles the transactions in {@code input} and writes the final accounts to {@code output}.
     */
    public SettlementStatistics settle(Path input, Writer output) throws IOException {
        log.info("Settling transactions from {}", input);
        try (Reader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            return settle(reader, output);
        }
    }

    /**
     * Applies every row of {@code input} in order, then writes the snapshot. Nothing is
     * written to {@code output} if reading fails or a malformed row aborts the run.
     *
     * @throws MalformedRecordException on the first invalid row when the policy is {@link MalformedRecordPolicy#ABORT}
     */
    public SettlementStatistics settle(Reader input, Writer output) throws IOException {
        SettlementStateMachine stateMachine = new SettlementStateMachine();
        SettlementStatistics statistics = new SettlementStatistics();

        try (MappingIterator<TransactionRow> rows = transactionCsvReader.open(input)) {
            while (rows.hasNextValue()) {
                TransactionRow row = rows.nextValue();
                long recordNumber = statistics.recordRead();

                Transaction transaction;
                try {
                    transaction = row.toTransaction();
                } catch (MalformedRecordException e) {
                    if (malformedRecordPolicy == MalformedRecordPolicy.ABORT) {
                        throw e.atRecord(recordNumber);
                    }
                    log.warn("Skipping malformed record #{} {}: {}", recordNumber, row, e.getMessage());
                    statistics.recordSkipped();
                    continue;
                }

                statistics.recordOutcome(stateMachine.apply(transaction));
            }
        }

        List<Account> accounts = stateMachine.snapshot();
        statistics.setAccounts(accounts.size());
        accountCsvWriter.write(accounts, output);
        log.info("Settlement completed: {}", statistics);
        return statistics;
    }
}
