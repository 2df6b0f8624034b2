package com.flagship.token_ledger.health;

import com.flagship.token_ledger.ledger.TokenLedgerService;
import com.flagship.token_ledger.persistence.KeyValueStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness/readiness probes.
 * Unlike the Actuator health endpoint, this does not require authorization.
 *
 * The ledger serves from memory, so a store outage is reported but does
 * not fail the probe.
 */
@RestController
public class HealthController {

    private final KeyValueStore store;
    private final TokenLedgerService ledger;

    public HealthController(KeyValueStore store, TokenLedgerService ledger) {
        this.store = store;
        this.ledger = ledger;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("store", store.name());
        response.put("storeStatus", checkStore() ? "UP" : "DEGRADED");
        response.put("initialized", ledger.getState().isInitialized());
        return ResponseEntity.ok(response);
    }

    private boolean checkStore() {
        try {
            return store.ping();
        } catch (Exception e) {
            return false;
        }
    }
}
