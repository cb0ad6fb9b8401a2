package com.flagship.invoice_ledger.job;

import com.flagship.invoice_ledger.store.InMemoryKeyValueStore;
import com.flagship.invoice_ledger.store.KeyValueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic housekeeping: fails jobs past their deadline and, for the in-memory store,
 * drops expired entries. Redis expires keys on its own.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobMaintenanceScheduler {

    private final JobService jobService;
    private final KeyValueStore store;

    @Scheduled(fixedDelayString = "${jobs.sweep-interval-ms:10000}")
    public void sweepOverdueJobs() {
        try {
            jobService.failOverdueJobs();
        } catch (Exception e) {
            log.error("Error in job timeout sweep", e);
        }
    }

    @Scheduled(fixedDelayString = "${store.purge-interval-ms:60000}")
    public void purgeExpiredEntries() {
        if (store instanceof InMemoryKeyValueStore inMemory) {
            int removed = inMemory.purgeExpired();
            if (removed > 0) {
                log.debug("Purged {} expired store entries", removed);
            }
        }
    }
}
