package com.flagship.invoice_ledger.observability;

import com.flagship.invoice_ledger.provider.ProviderRegistry;
import com.flagship.invoice_ledger.provider.ProviderState;
import com.flagship.invoice_ledger.store.KeyValueStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Custom health indicators for the invoice ledger service.
 *
 * These health checks determine if the service is ready to accept traffic.
 */
public class HealthIndicators {

    /**
     * Up while at least one provider can take a call. Down when every provider is
     * cooling down or out of daily quota: jobs would still complete, but every file would fail.
     */
    @Component("providersHealth")
    public static class ProviderAvailabilityHealthIndicator implements HealthIndicator {

        private final ProviderRegistry registry;

        public ProviderAvailabilityHealthIndicator(ProviderRegistry registry) {
            this.registry = registry;
        }

        @Override
        public Health health() {
            List<ProviderState> states = registry.snapshot();
            long available = states.stream().filter(ProviderState::isAvailable).count();

            Health.Builder builder = available > 0 ? Health.up() : Health.down();
            for (ProviderState state : states) {
                builder.withDetail(state.getProviderId(), state.isAvailable()
                        ? "available (" + state.getCallsUsedToday() + "/" + state.getDailyQuota() + ")"
                        : "unavailable" + (state.getLastError() != null ? ": " + state.getLastError() : ""));
            }
            return builder
                    .withDetail("available", available)
                    .withDetail("total", states.size())
                    .build();
        }
    }

    /**
     * Health indicator for the job and cache store.
     */
    @Component("keyValueStoreHealth")
    public static class KeyValueStoreHealthIndicator implements HealthIndicator {

        private final KeyValueStore store;

        public KeyValueStoreHealthIndicator(KeyValueStore store) {
            this.store = store;
        }

        @Override
        public Health health() {
            try {
                return store.ping()
                        ? Health.up().withDetail("store", store.getClass().getSimpleName()).build()
                        : Health.down().withDetail("store", store.getClass().getSimpleName()).build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Health indicator for Kafka connectivity, present only when job events go to Kafka.
     */
    @Component("kafkaHealth")
    @ConditionalOnProperty(name = "jobs.events.enabled", havingValue = "true")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.status("DEGRADED")
                            .withDetail("error", "No Kafka connections established")
                            .withDetail("note", "Job events are best effort; jobs keep running")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", "Job events are best effort; jobs keep running")
                        .build();
            }
        }
    }
}
