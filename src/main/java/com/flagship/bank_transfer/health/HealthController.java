package com.flagship.bank_transfer.health;

import com.flagship.bank_transfer.ledger.LedgerStore;
import com.flagship.bank_transfer.ledger.StoreHealth;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness endpoint. Unlike the Actuator health endpoint it needs no
 * authorization and reports only the ledger store.
 */
@RestController
public class HealthController {

    private final LedgerStore ledgerStore;
    private final Clock clock;

    public HealthController(LedgerStore ledgerStore, Clock clock) {
        this.ledgerStore = ledgerStore;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        StoreHealth ledger = ledgerStore.healthCheck();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", ledger == StoreHealth.OK ? "UP" : "DOWN");
        response.put("timestamp", clock.instant().toString());
        response.put("ledger", ledger.name());

        if (ledger != StoreHealth.OK) {
            return ResponseEntity.status(503).body(response);
        }
        return ResponseEntity.ok(response);
    }
}
