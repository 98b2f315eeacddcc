package com.flagship.impact_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ImpactLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImpactLedgerApplication.class, args);
    }
}
