package com.example.settlement.csv;

import com.example.settlement.dto.TransactionRow;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;

/**
 * Reads {@code type, client, tx, amount} rows lazily from a CSV source with a header line.
 */
@Component
@RequiredArgsConstructor
public class TransactionCsvReader {

    private static final CsvSchema SCHEMA = CsvSchema.emptySchema().withHeader();

    private final CsvMapper csvMapper;

    /**
     * Opens an iterator over the rows of {@code reader}. Closing the iterator closes the reader.
     */
    public MappingIterator<TransactionRow> open(Reader reader) throws IOException {
        return csvMapper.readerFor(TransactionRow.class)
                .with(SCHEMA)
                .readValues(reader);
    }
}
