package com.flagship.invoice_ledger.provider;

import com.flagship.invoice_ledger.config.ExtractionProperties;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered set of inference providers with per-provider quota and health state.
 *
 * Enforces:
 * 1. Providers are tried in configured priority order
 * 2. A provider in cooldown or out of daily quota is never selected
 * 3. Selection reserves a quota slot atomically (check and increment under one lock)
 * 4. A remote quota-exceeded answer parks the provider until the next daily reset,
 *    whatever the local count says
 *
 * State is owned by the instance, so each test can build a fresh registry with its own clock.
 */
@Slf4j
public class ProviderRegistry {

    private final Object lock = new Object();
    private final List<Slot> slots;
    private final Map<String, Slot> slotsById;
    private final ExtractionProperties.Quota policy;
    private final Clock clock;

    private LocalDate quotaDay;

    public ProviderRegistry(List<Registration> registrations, ExtractionProperties.Quota policy, Clock clock) {
        if (registrations == null || registrations.isEmpty()) {
            throw new IllegalArgumentException("At least one inference provider must be configured");
        }
        this.policy = policy;
        this.clock = clock;
        this.slots = new ArrayList<>();
        this.slotsById = new LinkedHashMap<>();
        int rank = 1;
        for (Registration registration : registrations) {
            String id = registration.getProvider().getId();
            if (slotsById.containsKey(id)) {
                throw new IllegalArgumentException("Duplicate provider id: " + id);
            }
            if (registration.getDailyQuota() <= 0) {
                throw new IllegalArgumentException("Daily quota must be positive for provider " + id);
            }
            Slot slot = new Slot(registration.getProvider(), rank++, registration.getDailyQuota());
            slots.add(slot);
            slotsById.put(id, slot);
        }
        this.quotaDay = currentQuotaDay(clock.instant());
    }

    /**
     * Picks the highest-priority provider that is neither cooling down nor out of quota,
     * and reserves one call against its daily quota.
     *
     * @return the selected provider, or {@link ProviderSelection#exhausted()} when every provider is skipped
     */
    public ProviderSelection selectProvider() {
        synchronized (lock) {
            Instant now = clock.instant();
            rollOverIfNewDay(now);
            for (Slot slot : slots) {
                if (slot.isCoolingDown(now) || slot.callsUsedToday >= slot.dailyQuota) {
                    continue;
                }
                slot.callsUsedToday++;
                return ProviderSelection.of(slot.provider);
            }
            return ProviderSelection.exhausted();
        }
    }

    /**
     * Records the outcome of a call made through a previous selection.
     *
     * @param providerId provider that was called
     * @param outcome what happened
     * @param detail short description kept for diagnostics, may be null
     */
    public void recordOutcome(String providerId, ProviderOutcome outcome, String detail) {
        synchronized (lock) {
            Slot slot = slotsById.get(providerId);
            if (slot == null) {
                throw new IllegalArgumentException("Unknown provider: " + providerId);
            }
            Instant now = clock.instant();
            switch (outcome) {
                case SUCCESS -> {
                    slot.consecutiveFailures = 0;
                    slot.lastError = null;
                }
                case QUOTA_EXCEEDED -> {
                    slot.cooldownUntil = nextResetBoundary(now);
                    slot.lastError = detail;
                    log.warn("Provider {} reported quota exhausted, parked until {}", providerId, slot.cooldownUntil);
                }
                case TRANSIENT_FAILURE -> {
                    // the call did not go through, so the reserved slot is handed back
                    slot.callsUsedToday = Math.max(0, slot.callsUsedToday - 1);
                    slot.consecutiveFailures++;
                    slot.lastError = detail;
                    if (slot.consecutiveFailures >= policy.getFailureThreshold()) {
                        Duration backoff = backoffFor(slot.consecutiveFailures);
                        Instant until = now.plus(backoff);
                        if (slot.cooldownUntil == null || until.isAfter(slot.cooldownUntil)) {
                            slot.cooldownUntil = until;
                        }
                        log.warn("Provider {} failed {} times in a row, cooling down for {}",
                            providerId, slot.consecutiveFailures, backoff);
                    }
                }
            }
        }
    }

    /**
     * Clears every cooldown, counter and failure streak.
     */
    public void reset() {
        synchronized (lock) {
            for (Slot slot : slots) {
                slot.callsUsedToday = 0;
                slot.cooldownUntil = null;
                slot.consecutiveFailures = 0;
                slot.lastError = null;
            }
            quotaDay = currentQuotaDay(clock.instant());
        }
        log.info("Provider registry reset: {} providers available", slots.size());
    }

    /**
     * Current state of every provider, in priority order.
     */
    public List<ProviderState> snapshot() {
        synchronized (lock) {
            Instant now = clock.instant();
            rollOverIfNewDay(now);
            List<ProviderState> states = new ArrayList<>(slots.size());
            for (Slot slot : slots) {
                boolean available = !slot.isCoolingDown(now) && slot.callsUsedToday < slot.dailyQuota;
                states.add(new ProviderState(
                    slot.provider.getId(),
                    slot.rank,
                    slot.dailyQuota,
                    slot.callsUsedToday,
                    slot.isCoolingDown(now) ? slot.cooldownUntil : null,
                    slot.consecutiveFailures,
                    slot.lastError,
                    available
                ));
            }
            return states;
        }
    }

    public Optional<ProviderState> state(String providerId) {
        return snapshot().stream()
            .filter(state -> state.getProviderId().equals(providerId))
            .findFirst();
    }

    public int size() {
        return slots.size();
    }

    /**
     * First instant of the next quota day in the configured reset zone.
     */
    Instant nextResetBoundary(Instant now) {
        return currentQuotaDay(now).plusDays(1)
            .atStartOfDay(policy.getResetZone())
            .toInstant();
    }

    private Duration backoffFor(int consecutiveFailures) {
        int exponent = Math.min(consecutiveFailures - policy.getFailureThreshold(), 20);
        Duration backoff = policy.getBaseBackoff().multipliedBy(1L << exponent);
        return backoff.compareTo(policy.getMaxBackoff()) > 0 ? policy.getMaxBackoff() : backoff;
    }

    private void rollOverIfNewDay(Instant now) {
        LocalDate today = currentQuotaDay(now);
        if (!today.equals(quotaDay)) {
            for (Slot slot : slots) {
                slot.callsUsedToday = 0;
            }
            log.info("Quota day rolled over from {} to {}, usage counters cleared", quotaDay, today);
            quotaDay = today;
        }
    }

    private LocalDate currentQuotaDay(Instant now) {
        return now.atZone(policy.getResetZone()).toLocalDate();
    }

    /**
     * A provider together with its configured daily quota.
     */
    @Value(staticConstructor = "of")
    public static class Registration {
        InferenceProvider provider;
        int dailyQuota;
    }

    private static final class Slot {
        final InferenceProvider provider;
        final int rank;
        final int dailyQuota;
        int callsUsedToday;
        Instant cooldownUntil;
        int consecutiveFailures;
        String lastError;

        Slot(InferenceProvider provider, int rank, int dailyQuota) {
            this.provider = provider;
            this.rank = rank;
            this.dailyQuota = dailyQuota;
        }

        boolean isCoolingDown(Instant now) {
            return cooldownUntil != null && now.isBefore(cooldownUntil);
        }
    }
}
