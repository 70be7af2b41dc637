package com.example.settlement;

import com.example.settlement.exception.MalformedRecordException;
import com.example.settlement.service.SettlementService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class SettlementRunnerTest {

    @TempDir
    Path tempDir;

    private SettlementService settlementService;
    private ByteArrayOutputStream out;
    private SettlementRunner runner;

    @BeforeEach
    void setUp() {
        settlementService = mock(SettlementService.class);
        out = new ByteArrayOutputStream();
        runner = new SettlementRunner(settlementService, out);
    }

    @Test
    void missingArgumentIsUsageError() {
        runner.run(new DefaultApplicationArguments());

        assertEquals(SettlementRunner.EXIT_USAGE, runner.getExitCode());
        verifyNoInteractions(settlementService);
    }

    @Test
    void extraArgumentsAreUsageError() {
        runner.run(new DefaultApplicationArguments("a.csv", "b.csv"));

        assertEquals(SettlementRunner.EXIT_USAGE, runner.getExitCode());
    }

    @Test
    void unreadableInputFails() {
        runner.run(new DefaultApplicationArguments(tempDir.resolve("missing.csv").toString()));

        assertEquals(SettlementRunner.EXIT_FAILURE, runner.getExitCode());
        verifyNoInteractions(settlementService);
    }

    @Test
    void settlesInputToOutputStream() throws IOException {
        Path input = Files.writeString(tempDir.resolve("tx.csv"), "type,client,tx,amount\n");
        doAnswer(invocation -> {
            Writer writer = invocation.getArgument(1);
            writer.write("client,available,held,total,locked\n");
            return null;
        }).when(settlementService).settle(eq(input), any(Writer.class));

        runner.run(new DefaultApplicationArguments("--spring.main.banner-mode=off", input.toString()));

        assertEquals(SettlementRunner.EXIT_OK, runner.getExitCode());
        assertEquals("client,available,held,total,locked\n", out.toString());
        verify(settlementService).settle(eq(input), any(Writer.class));
    }

    @Test
    void malformedInputFails() throws IOException {
        Path input = Files.writeString(tempDir.resolve("tx.csv"), "type,client,tx,amount\n");
        doThrow(new MalformedRecordException("bad row").atRecord(1))
                .when(settlementService).settle(eq(input), any(Writer.class));

        runner.run(new DefaultApplicationArguments(input.toString()));

        assertEquals(SettlementRunner.EXIT_FAILURE, runner.getExitCode());
        assertEquals("", out.toString());
    }

    @Test
    void ioFailureFails() throws IOException {
        Path input = Files.writeString(tempDir.resolve("tx.csv"), "type,client,tx,amount\n");
        doThrow(new IOException("disk gone")).when(settlementService).settle(eq(input), any(Writer.class));

        runner.run(new DefaultApplicationArguments(input.toString()));

        assertEquals(SettlementRunner.EXIT_FAILURE, runner.getExitCode());
    }

    @Test
    void unexpectedRuntimeFailureFails() throws IOException {
        Path input = Files.writeString(tempDir.resolve("tx.csv"), "type,client,tx,amount\n");
        doThrow(new ArithmeticException("overflow")).when(settlementService).settle(eq(input), any(Writer.class));

        runner.run(new DefaultApplicationArguments(input.toString()));

        assertEquals(SettlementRunner.EXIT_FAILURE, runner.getExitCode());
        assertEquals("", out.toString());
    }
}
