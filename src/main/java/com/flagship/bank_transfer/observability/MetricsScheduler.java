package com.flagship.bank_transfer.observability;

import com.flagship.bank_transfer.session.SessionManager;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodically samples state that is too expensive to read on every scrape:
 * the outbox backlog and the number of open sessions ({@code sessions.active}).
 */
@Component
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final SessionManager sessionManager;
    private final AtomicInteger activeSessions = new AtomicInteger();

    public MetricsScheduler(OutboxMetrics outboxMetrics, SessionManager sessionManager, MeterRegistry registry) {
        this.outboxMetrics = outboxMetrics;
        this.sessionManager = sessionManager;
        Gauge.builder("sessions.active", activeSessions, AtomicInteger::get)
                .description("Sessions currently held in memory, including expired ones not yet purged")
                .register(registry);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refresh() {
        outboxMetrics.refresh();
        activeSessions.set(sessionManager.activeSessionCount());
    }

    int getActiveSessions() {
        return activeSessions.get();
    }
}
