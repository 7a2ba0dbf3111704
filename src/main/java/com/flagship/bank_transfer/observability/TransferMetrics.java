package com.flagship.bank_transfer.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Micrometer meters for logins, transfers and ledger store failures.
 *
 * <ul>
 *   <li>{@code transfers.submitted{status,reason}}: transfers by terminal outcome</li>
 *   <li>{@code transfers.replayed}: idempotent resubmissions answered from the original</li>
 *   <li>{@code transfers.latency{operation}}: engine timings</li>
 *   <li>{@code auth.logins{result}}: login attempts</li>
 *   <li>{@code store.failures{operation}}: STORE_UNAVAILABLE occurrences</li>
 * </ul>
 */
@Component
public class TransferMetrics {

    private final MeterRegistry registry;

    public TransferMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransfer(String status, String reason) {
        registry.counter("transfers.submitted",
                "status", status,
                "reason", reason == null ? "none" : reason
        ).increment();
    }

    public void recordReplay() {
        registry.counter("transfers.replayed").increment();
    }

    public void recordLogin(boolean success) {
        registry.counter("auth.logins", "result", success ? "success" : "failure").increment();
    }

    public void recordStoreFailure(String operation) {
        registry.counter("store.failures", "operation", operation).increment();
    }

    public <T> T time(String operation, Supplier<T> action) {
        Timer timer = Timer.builder("transfers.latency")
                .description("Time spent in transfer engine operations")
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
        return timer.record(action);
    }
}
