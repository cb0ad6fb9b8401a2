package com.flagship.invoice_ledger.observability;

import com.flagship.invoice_ledger.job.JobService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Process-wide counters since startup, read from the meter registry.
 */
@RestController
@RequiredArgsConstructor
public class StatsController {

    private final ExtractionMetrics metrics;
    private final JobService jobService;

    @GetMapping(value = "/api/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> stats = metrics.statistics();
        stats.put("active_jobs", jobService.activeJobCount());
        return ResponseEntity.ok(stats);
    }
}
