package com.flagship.invoice_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Centralized metrics for extraction and job processing.
 *
 * Metrics exposed:
 * - extraction.provider.calls: provider calls tagged by provider and outcome
 * - extraction.provider.latency: provider call duration
 * - extraction.cache: content cache hits and misses
 * - extraction.results: per-file outcomes
 * - jobs.created: jobs accepted, by transaction type
 * - jobs.lifecycle: jobs reaching a terminal status
 * - jobs.active: jobs currently pending or processing
 */
@Component
public class ExtractionMetrics {

    private final MeterRegistry registry;

    public ExtractionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ==================== Provider Metrics ====================

    public void recordProviderCall(String providerId, String outcome, Duration duration) {
        registry.counter("extraction.provider.calls",
                "provider", sanitizeTag(providerId),
                "outcome", sanitizeTag(outcome)
        ).increment();
        registry.timer("extraction.provider.latency",
                "provider", sanitizeTag(providerId)
        ).record(duration);
    }

    public void recordProvidersExhausted() {
        registry.counter("extraction.provider.exhausted").increment();
    }

    // ==================== Cache Metrics ====================

    public void recordCacheHit() {
        registry.counter("extraction.cache", "result", "hit").increment();
    }

    public void recordCacheMiss() {
        registry.counter("extraction.cache", "result", "miss").increment();
    }

    // ==================== Result Metrics ====================

    public void recordExtraction(String status) {
        registry.counter("extraction.results", "status", sanitizeTag(status)).increment();
    }

    // ==================== Job Metrics ====================

    public void recordJobCreated(String transactionType, int fileCount) {
        registry.counter("jobs.created", "transaction_type", sanitizeTag(transactionType)).increment();
        registry.counter("jobs.files.submitted").increment(fileCount);
    }

    public void recordJobFinished(String status, Duration duration) {
        registry.counter("jobs.lifecycle", "status", sanitizeTag(status)).increment();
        registry.timer("jobs.duration", "status", sanitizeTag(status)).record(duration);
    }

    public void registerActiveJobsGauge(Supplier<Number> supplier) {
        Gauge.builder("jobs.active", supplier)
                .description("Jobs currently pending or processing")
                .strongReference(true)
                .register(registry);
    }

    // ==================== Statistics ====================

    /**
     * Aggregated counters for the stats endpoint.
     */
    public Map<String, Object> statistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("jobs_created", sum("jobs.created", null, null));
        stats.put("jobs_completed", sum("jobs.lifecycle", "status", "completed"));
        stats.put("jobs_failed", sum("jobs.lifecycle", "status", "failed"));
        stats.put("files_submitted", sum("jobs.files.submitted", null, null));
        stats.put("extractions_succeeded", sum("extraction.results", "status", "success"));
        stats.put("extractions_failed", sum("extraction.results", "status", "failed"));
        stats.put("cache_hits", sum("extraction.cache", "result", "hit"));
        stats.put("cache_misses", sum("extraction.cache", "result", "miss"));
        stats.put("provider_calls", sum("extraction.provider.calls", null, null));
        stats.put("provider_exhaustions", sum("extraction.provider.exhausted", null, null));
        return stats;
    }

    private long sum(String name, String tagKey, String tagValue) {
        var search = registry.find(name);
        if (tagKey != null) {
            search = search.tag(tagKey, tagValue);
        }
        return (long) search.counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    // ==================== Helper Methods ====================

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_.\\-]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
