package com.example.settlement.csv;

import com.example.settlement.config.CsvConfig;
import com.example.settlement.model.Account;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AccountCsvWriterTest {

    private final AccountCsvWriter writer = new AccountCsvWriter(new CsvConfig().csvMapper());

    @Test
    void writesFourDecimalPlaces() throws IOException {
        Account first = new Account(2);
        first.credit(new BigDecimal("1.5"));
        first.hold(new BigDecimal("0.25"));
        Account second = new Account(1);
        second.credit(new BigDecimal("10"));
        second.hold(new BigDecimal("10"));
        second.chargeBack(new BigDecimal("10"));

        StringWriter out = new StringWriter();
        writer.write(List.of(first, second), out);

        assertThat(out.toString().split("\n")).containsExactly(
                "client,available,held,total,locked",
                "2,1.2500,0.2500,1.5000,false",
                "1,0.0000,0.0000,0.0000,true");
    }

    @Test
    void writesHeaderForNoAccounts() throws IOException {
        StringWriter out = new StringWriter();
        writer.write(List.of(), out);

        assertThat(out.toString()).isEqualTo("client,available,held,total,locked\n");
    }
}
