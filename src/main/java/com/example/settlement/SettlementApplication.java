package com.example.settlement;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@Slf4j
@SpringBootApplication
public class SettlementApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(SettlementApplication.class, args);
        int status = SpringApplication.exit(context);
        if (status != 0) {
            log.error("Settlement finished with exit code {}", status);
        }
        System.exit(status);
    }
}
