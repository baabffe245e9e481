package com.fintech.ledger;

import com.fintech.ledger.config.LedgerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Streaming Client Account Ledger
 *
 * Reads a CSV stream of deposits, withdrawals, disputes, resolves and chargebacks,
 * applies them to per-client accounts and prints the final balances.
 *
 * Architecture:
 * - Producer thread decodes the input onto a bounded channel (backpressure)
 * - Consumer thread applies each transaction to a lock-guarded account store
 * - Rejected transactions are logged and skipped; malformed input stops the stream
 * - Ctrl-C cancels cooperatively, never leaving a transaction half-applied
 */
@SpringBootApplication
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(LedgerApplication.class, args)));
    }
}
