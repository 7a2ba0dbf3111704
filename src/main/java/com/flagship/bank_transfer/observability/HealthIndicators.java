package com.flagship.bank_transfer.observability;

import com.flagship.bank_transfer.ledger.LedgerStore;
import com.flagship.bank_transfer.ledger.StoreHealth;
import com.flagship.bank_transfer.outbox.OutboxService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicators for the ledger store and the outbox backlog.
 */
public class HealthIndicators {

    private HealthIndicators() {
    }

    @Component("ledgerStore")
    public static class LedgerStoreHealthIndicator implements HealthIndicator {

        private final LedgerStore ledgerStore;

        public LedgerStoreHealthIndicator(LedgerStore ledgerStore) {
            this.ledgerStore = ledgerStore;
        }

        @Override
        public Health health() {
            StoreHealth health = ledgerStore.healthCheck();
            if (health == StoreHealth.OK) {
                return Health.up().withDetail("ledger", health.name()).build();
            }
            return Health.status("DEGRADED").withDetail("ledger", health.name()).build();
        }
    }

    /**
     * Unhealthy when too many events wait to be published.
     */
    @Component("outbox")
    public static class OutboxHealthIndicator implements HealthIndicator {

        static final long BACKLOG_WARNING_THRESHOLD = 1000;
        static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxService outboxService;

        public OutboxHealthIndicator(OutboxService outboxService) {
            this.outboxService = outboxService;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxService.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (DataAccessException e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }
}
