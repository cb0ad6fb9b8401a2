package com.flagship.invoice_ledger.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.invoice_ledger.store.KeyValueStore;
import com.flagship.invoice_ledger.store.KeyValueStoreException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Maps a content fingerprint to a previously extracted result.
 *
 * Entries are write-once (set-if-absent) and expire after the configured TTL.
 * Store failures degrade to a miss or a skipped write: the cache only saves provider calls.
 */
@Slf4j
public class ContentCache {

    private static final String KEY_PREFIX = "extraction:";

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Duration ttl;
    private final Clock clock;

    public ContentCache(KeyValueStore store, ObjectMapper objectMapper, Duration ttl, Clock clock) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
        this.clock = clock;
    }

    public Optional<CachedExtraction> get(String contentHash) {
        try {
            Optional<String> json = store.get(KEY_PREFIX + contentHash);
            if (json.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json.get(), CachedExtraction.class));
        } catch (KeyValueStoreException e) {
            log.warn("Cache lookup failed for {}, treating as miss: {}", contentHash, e.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry {}: {}", contentHash, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Stores an extraction unless an entry already exists for the fingerprint.
     *
     * @return true if this call wrote the entry
     */
    public boolean put(String contentHash, InvoiceFields fields, String providerId) {
        CachedExtraction entry = new CachedExtraction(fields, providerId, clock.instant());
        try {
            boolean written = store.setIfAbsent(KEY_PREFIX + contentHash, objectMapper.writeValueAsString(entry), ttl);
            if (written) {
                log.debug("Cached extraction {} from provider {}", contentHash, providerId);
            }
            return written;
        } catch (KeyValueStoreException e) {
            log.warn("Cache write failed for {}: {}", contentHash, e.getMessage());
            return false;
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize extraction {} for caching: {}", contentHash, e.getOriginalMessage());
            return false;
        }
    }

    @Value
    public static class CachedExtraction {
        InvoiceFields fields;
        String providerId;
        Instant cachedAt;
    }
}
