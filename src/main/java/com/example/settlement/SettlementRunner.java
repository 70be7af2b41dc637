package com.example.settlement;

import com.example.settlement.exception.MalformedRecordException;
import com.example.settlement.service.SettlementService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command line entry: {@code settlement-engine <transactions.csv>}, accounts are written to stdout.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "settlement.runner.enabled", havingValue = "true", matchIfMissing = true)
public class SettlementRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final SettlementService settlementService;
    private final OutputStream out;
    private int exitCode = EXIT_OK;

    @Autowired
    public SettlementRunner(SettlementService settlementService) {
        this(settlementService, System.out);
    }

    SettlementRunner(SettlementService settlementService, OutputStream out) {
        this.settlementService = settlementService;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> paths = args.getNonOptionArgs();
        if (paths.size() != 1) {
            log.error("Expected exactly one argument, the transactions CSV file, got {}", paths);
            log.error("Usage: settlement-engine <transactions.csv>");
            exitCode = EXIT_USAGE;
            return;
        }

        Path input = Path.of(paths.get(0));
        if (!Files.isReadable(input)) {
            log.error("Transactions file {} does not exist or is not readable", input);
            exitCode = EXIT_FAILURE;
            return;
        }

        try {
            Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
            settlementService.settle(input, writer);
            writer.flush();
        } catch (MalformedRecordException e) {
            log.error("Malformed input in {}, no accounts written: {}", input, e.getMessage());
            exitCode = EXIT_FAILURE;
        } catch (IOException e) {
            log.error("Failed to settle {}: {}", input, e.getMessage(), e);
            exitCode = EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("Unexpected failure settling {}: {}", input, e.getMessage(), e);
            exitCode = EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
