package com.example.settlement.integration;

import com.example.settlement.SettlementRunner;
import com.example.settlement.service.SettlementService;
import com.example.settlement.service.SettlementStatistics;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.core.io.ClassPathResource;
import org.springframework.test.context.ActiveProfiles;

import java.io.StringWriter;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest
@ActiveProfiles("test")
class SettlementIntegrationTest {

    @Autowired
    private SettlementService settlementService;

    @Autowired
    private ApplicationContext applicationContext;

    @Test
    void runnerIsDisabledInTests() {
        assertThat(applicationContext.getBeansOfType(SettlementRunner.class)).isEmpty();
    }

    @Test
    void settlesFixtureFile() throws Exception {
        Path input = new ClassPathResource("fixtures/transactions.csv").getFile().toPath();
        StringWriter out = new StringWriter();

        SettlementStatistics statistics = settlementService.settle(input, out);

        assertThat(out.toString().split("\n")).containsExactly(
                "client,available,held,total,locked",
                "1,2.0000,0.0000,2.0000,true",
                "2,2.0000,0.0000,2.0000,false",
                "3,1.2345,0.0000,1.2345,false");
        assertEquals(11, statistics.getRecordsRead());
        assertEquals(9, statistics.getApplied());
        assertEquals(2, statistics.getRejected());
        assertEquals(3, statistics.getAccounts());
    }
}
