package com.flagship.asset_issuance.health;

import com.flagship.asset_issuance.ledger.LedgerClient;
import com.flagship.asset_issuance.ledger.LedgerException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness endpoint that also reports whether Horizon answers.
 */
@RestController
public class HealthController {

    private final LedgerClient ledgerClient;

    public HealthController(LedgerClient ledgerClient) {
        this.ledgerClient = ledgerClient;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("network", String.valueOf(ledgerClient.network()));

        boolean horizonHealthy = checkHorizon();
        response.put("horizon", horizonHealthy ? "UP" : "DOWN");

        if (!horizonHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkHorizon() {
        try {
            ledgerClient.fetchBaseFee();
            return true;
        } catch (LedgerException e) {
            return false;
        }
    }
}
