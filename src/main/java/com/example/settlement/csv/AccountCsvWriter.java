package com.example.settlement.csv;

import com.example.settlement.dto.AccountRow;
import com.example.settlement.model.Account;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

@Slf4j
@Component
public class AccountCsvWriter {

    private final CsvMapper csvMapper;
    private final CsvSchema schema;

    public AccountCsvWriter(CsvMapper csvMapper) {
        this.csvMapper = csvMapper;
        this.schema = csvMapper.schemaFor(AccountRow.class).withHeader();
    }

    /**
     * Writes a header and one row per account. The target is flushed but left open.
     */
    public void write(List<Account> accounts, Writer target) throws IOException {
        if (accounts.isEmpty()) {
            // the generator only emits the header together with the first row
            target.write(String.join(String.valueOf(schema.getColumnSeparator()), schema.getColumnNames()));
            target.write(schema.getLineSeparator());
            target.flush();
            return;
        }
        try (SequenceWriter rows = csvMapper.writer(schema).writeValues(target)) {
            for (Account account : accounts) {
                rows.write(AccountRow.fromEntity(account));
            }
        }
        target.flush();
        log.debug("Wrote {} account rows", accounts.size());
    }
}
