package com.lendingpool;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main Spring Boot application for the Lending Pool Engine.
 *
 * The engine keeps the books of a collateralized lending protocol:
 * - Per-asset pools (deposits, borrows, reserves) with lazy interest accrual
 * - A kinked utilization-based interest rate curve
 * - Individual loans with a principal/interest split
 * - Health-factor driven liquidation with proportional collateral seizure
 *
 * Architecture flow:
 * User -> REST API -> Transaction (row locks + accrual + mutation + outbox) -> Outbox Publisher -> Kafka
 *
 * Token custody is external. Every operation returns the amounts the custody
 * ledger has to move, and the engine only records the accounting side.
 */
@SpringBootApplication
@EnableScheduling  // Outbox publisher
public class LendingPoolApplication {

    public static void main(String[] args) {
        SpringApplication.run(LendingPoolApplication.class, args);
    }
}
