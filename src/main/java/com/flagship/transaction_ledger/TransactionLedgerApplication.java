package com.flagship.transaction_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Replays a CSV file of client transactions and prints the resulting account balances.
 */
@SpringBootApplication
public class TransactionLedgerApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TransactionLedgerApplication.class, args)));
    }
}
