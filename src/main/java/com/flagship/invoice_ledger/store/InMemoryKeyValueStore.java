package com.flagship.invoice_ledger.store;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local store for single-node deployments and tests.
 *
 * Expired entries are dropped lazily on read and in bulk by {@link #purgeExpired()}.
 */
@Slf4j
public class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        entries.put(key, new Entry(value, expiry(ttl)));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        Entry fresh = new Entry(value, expiry(ttl));
        Instant now = clock.instant();
        // compute() keeps the check and the write atomic for this key only
        Entry[] previous = new Entry[1];
        entries.compute(key, (k, existing) -> {
            if (existing != null && !existing.isExpired(now)) {
                previous[0] = existing;
                return existing;
            }
            return fresh;
        });
        return previous[0] == null;
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    @Override
    public boolean ping() {
        return true;
    }

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("Purged {} expired entries", removed);
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    private Instant expiry(Duration ttl) {
        return ttl == null ? null : clock.instant().plus(ttl);
    }

    private record Entry(String value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
