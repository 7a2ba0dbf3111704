package com.flagship.bank_transfer.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Seeds the two demo customers when {@code banking.demo-data.enabled=true}.
 * Existing users are left untouched, so restarts are harmless.
 */
@Component
@ConditionalOnProperty(name = "banking.demo-data.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DemoDataInitializer implements CommandLineRunner {

    private final LedgerStore ledgerStore;

    @Override
    public void run(String... args) {
        seed("alice", "alice123", "alice@example.com", new BigDecimal("50000.00"));
        seed("bob", "bob123", "bob@example.com", new BigDecimal("1000.00"));
    }

    private void seed(String username, String secret, String email, BigDecimal balance) {
        if (ledgerStore.createUser(username, secret, email, balance)) {
            log.info("Demo user {} provisioned with balance {}", username, balance);
        }
    }
}
