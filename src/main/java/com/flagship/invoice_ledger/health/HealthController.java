package com.flagship.invoice_ledger.health;

import com.flagship.invoice_ledger.job.JobService;
import com.flagship.invoice_ledger.provider.ProviderRegistry;
import com.flagship.invoice_ledger.provider.ProviderState;
import com.flagship.invoice_ledger.store.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
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
 * Only the store decides the status: with no provider available, jobs still
 * complete with failed files, so the service stays UP.
 */
@RestController
@Slf4j
public class HealthController {

    private final KeyValueStore store;
    private final ProviderRegistry providerRegistry;
    private final JobService jobService;
    private final String version;

    public HealthController(KeyValueStore store,
                            ProviderRegistry providerRegistry,
                            JobService jobService,
                            @Value("${info.app.version:0.1.0}") String version) {
        this.store = store;
        this.providerRegistry = providerRegistry;
        this.jobService = jobService;
        this.version = version;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("version", version);

        boolean storeHealthy = checkStore();
        response.put("store", storeHealthy ? "UP" : "DOWN");

        long available = providerRegistry.snapshot().stream().filter(ProviderState::isAvailable).count();
        response.put("providers_available", available);
        response.put("providers_total", providerRegistry.size());
        response.put("active_jobs", jobService.activeJobCount());

        if (!storeHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkStore() {
        try {
            return store.ping();
        } catch (RuntimeException e) {
            log.warn("Store ping failed: {}", e.getMessage());
            return false;
        }
    }
}
