package com.flagship.invoice_ledger.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value persistence used for job records and cached extractions.
 *
 * A {@code null} time-to-live means the entry does not expire.
 * Implementations throw {@link KeyValueStoreException} when the backend is unreachable.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    /**
     * Stores the value only if no live entry exists for the key.
     *
     * @return true if the value was written
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    void delete(String key);

    /**
     * Round-trip check used by health reporting.
     */
    boolean ping();
}
