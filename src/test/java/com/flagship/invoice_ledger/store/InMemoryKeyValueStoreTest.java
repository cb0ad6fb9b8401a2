package com.flagship.invoice_ledger.store;

import com.flagship.invoice_ledger.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryKeyValueStoreTest {

    private MutableClock clock;
    private InMemoryKeyValueStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-15T10:00:00Z"));
        store = new InMemoryKeyValueStore(clock);
    }

    @Test
    @DisplayName("Values are readable until their TTL elapses")
    void valuesExpireAfterTtl() {
        store.set("job:1", "{}", Duration.ofMinutes(5));

        clock.advance(Duration.ofMinutes(4));
        assertEquals(Optional.of("{}"), store.get("job:1"));

        clock.advance(Duration.ofMinutes(1));
        assertTrue(store.get("job:1").isEmpty());
    }

    @Test
    @DisplayName("A null TTL never expires")
    void nullTtlNeverExpires() {
        store.set("key", "value", null);
        clock.advance(Duration.ofDays(365));
        assertEquals(Optional.of("value"), store.get("key"));
    }

    @Test
    @DisplayName("setIfAbsent keeps the first live value")
    void setIfAbsentIsWriteOnce() {
        assertTrue(store.setIfAbsent("extraction:abc", "first", Duration.ofHours(1)));
        assertFalse(store.setIfAbsent("extraction:abc", "second", Duration.ofHours(1)));
        assertEquals(Optional.of("first"), store.get("extraction:abc"));
    }

    @Test
    @DisplayName("setIfAbsent replaces an expired value")
    void setIfAbsentReplacesExpiredValue() {
        store.setIfAbsent("extraction:abc", "first", Duration.ofMinutes(1));
        clock.advance(Duration.ofMinutes(2));

        assertTrue(store.setIfAbsent("extraction:abc", "second", Duration.ofMinutes(1)));
        assertEquals(Optional.of("second"), store.get("extraction:abc"));
    }

    @Test
    @DisplayName("purgeExpired removes only expired entries")
    void purgeRemovesExpiredEntries() {
        store.set("short", "a", Duration.ofSeconds(10));
        store.set("long", "b", Duration.ofHours(1));
        store.set("forever", "c", null);
        clock.advance(Duration.ofMinutes(1));

        assertEquals(1, store.purgeExpired());
        assertEquals(2, store.size());
        assertTrue(store.get("long").isPresent());
    }

    @Test
    @DisplayName("delete removes the entry")
    void deleteRemovesEntry() {
        store.set("key", "value", null);
        store.delete("key");
        assertTrue(store.get("key").isEmpty());
        assertTrue(store.ping());
    }
}
