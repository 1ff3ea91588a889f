package com.coopledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the cooperative ledger engine.
 *
 * Posts double-entry journal entries for a member-owned savings and loan
 * cooperative and drives the monthly declaration, deposit, penalty and loan
 * lifecycles that produce them.
 */
@SpringBootApplication
@EnableScheduling
public class CoopLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoopLedgerApplication.class, args);
    }
}
