package com.flagship.bank_transfer.transfer;

import com.flagship.bank_transfer.ledger.AccountRepository;
import com.flagship.bank_transfer.ledger.LedgerStore;
import com.flagship.bank_transfer.ledger.TransferStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent submissions against the embedded ledger: per-account serialization,
 * no lost updates and no deadlock between opposite transfers.
 */
@SpringBootTest
@ActiveProfiles("test")
class TransferEngineConcurrencyTest {

    @Autowired
    private TransferEngine transferEngine;

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private ExecutorService executor;
    private String suffix;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(8);
        suffix = UUID.randomUUID().toString().substring(0, 8);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(10, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("A transfer touching a locked account waits; unrelated accounts proceed")
    void testPerAccountSerialization() throws Exception {
        String a = user("a", "1000.00");
        String b = user("b", "0.00");
        String c = user("c", "1000.00");
        String d = user("d", "0.00");

        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        TransactionTemplate tx = new TransactionTemplate(transactionManager);

        Future<?> holder = executor.submit(() -> tx.executeWithoutResult(status -> {
            accountRepository.findByUsernameForUpdate(a).orElseThrow();
            locked.countDown();
            try {
                release.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
        assertTrue(locked.await(10, TimeUnit.SECONDS), "row lock was not acquired");

        Future<TransferResult> blocked = executor.submit(() -> transferEngine.submitTransfer(a, b, "100.00", null));
        Future<TransferResult> unrelated = executor.submit(() -> transferEngine.submitTransfer(c, d, "100.00", null));

        TransferResult unrelatedResult = unrelated.get(5, TimeUnit.SECONDS);
        assertEquals(TransferStatus.COMPLETED, unrelatedResult.getStatus());
        assertThrows(TimeoutException.class, () -> blocked.get(500, TimeUnit.MILLISECONDS));

        release.countDown();
        holder.get(10, TimeUnit.SECONDS);

        TransferResult blockedResult = blocked.get(10, TimeUnit.SECONDS);
        assertEquals(TransferStatus.COMPLETED, blockedResult.getStatus());
        assertEquals(new BigDecimal("900.00"), balance(a));
        assertEquals(new BigDecimal("100.00"), balance(b));
    }

    @Test
    @DisplayName("Concurrent debits of one account lose no update")
    void testNoLostUpdates() throws Exception {
        String payer = user("payer", "1000.00");
        String payee = user("payee", "0.00");
        int threads = 8;
        int perThread = 25;

        List<Future<Integer>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(executor.submit(() -> {
                int completed = 0;
                for (int i = 0; i < perThread; i++) {
                    TransferResult result = transferEngine.submitTransfer(payer, payee, "1.00", null);
                    if (result.isCompleted()) {
                        completed++;
                    }
                }
                return completed;
            }));
        }

        int completed = 0;
        for (Future<Integer> future : futures) {
            completed += future.get(60, TimeUnit.SECONDS);
        }

        assertEquals(threads * perThread, completed);
        assertEquals(new BigDecimal("800.00"), balance(payer));
        assertEquals(new BigDecimal("200.00"), balance(payee));
    }

    @Test
    @DisplayName("Racing debits never overdraw: exactly the affordable number complete")
    void testNoOverdraft() throws Exception {
        String payer = user("short", "50.00");
        String payee = user("sink", "0.00");

        List<Future<TransferResult>> futures = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            futures.add(executor.submit(() -> transferEngine.submitTransfer(payer, payee, "10.00", null)));
        }

        int completed = 0;
        for (Future<TransferResult> future : futures) {
            if (future.get(30, TimeUnit.SECONDS).isCompleted()) {
                completed++;
            }
        }

        assertEquals(5, completed);
        assertEquals(0, BigDecimal.ZERO.compareTo(balance(payer)));
        assertEquals(new BigDecimal("50.00"), balance(payee));
    }

    @Test
    @DisplayName("Opposite transfers between the same pair complete without deadlock")
    void testOppositeDirectionsDoNotDeadlock() throws Exception {
        String x = user("x", "1000.00");
        String y = user("y", "1000.00");
        int rounds = 20;

        Future<Integer> forward = executor.submit(() -> run(x, y, rounds));
        Future<Integer> backward = executor.submit(() -> run(y, x, rounds));

        assertEquals(rounds, forward.get(60, TimeUnit.SECONDS));
        assertEquals(rounds, backward.get(60, TimeUnit.SECONDS));
        assertEquals(new BigDecimal("1000.00"), balance(x));
        assertEquals(new BigDecimal("1000.00"), balance(y));
    }

    private int run(String from, String to, int rounds) {
        int completed = 0;
        for (int i = 0; i < rounds; i++) {
            if (transferEngine.submitTransfer(from, to, "5.00", null).isCompleted()) {
                completed++;
            }
        }
        return completed;
    }

    private String user(String prefix, String opening) {
        String username = prefix + "-" + suffix;
        assertTrue(ledgerStore.createUser(username, "pw", null, new BigDecimal(opening)));
        return username;
    }

    private BigDecimal balance(String username) {
        return ledgerStore.getBalance(username).orElseThrow();
    }
}
