package com.flagship.finance_ledger.health;

import com.flagship.finance_ledger.ledger.FinanceLedger;
import com.flagship.finance_ledger.snapshot.LedgerSnapshotStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness and readiness checks.
 * Unlike the Actuator health endpoint, this does not require authorization.
 */
@RestController
public class HealthController {

    private final FinanceLedger ledger;
    private final LedgerSnapshotStore snapshotStore;

    public HealthController(FinanceLedger ledger, LedgerSnapshotStore snapshotStore) {
        this.ledger = ledger;
        this.snapshotStore = snapshotStore;
    }

    /**
     * Counts are plain fields on the ledger and are read without the command
     * lock; a value may be one command stale.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("transactions", ledger.getTransactionCount());
        response.put("budgets", ledger.getBudgetCount());
        response.put("bills", ledger.getBillCount());
        response.put("snapshot", snapshotStore.isEnabled() ? "ENABLED" : "DISABLED");
        return ResponseEntity.ok(response);
    }
}
