package com.flagship.invoice_ledger.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.invoice_ledger.store.KeyValueStore;
import com.flagship.invoice_ledger.store.KeyValueStoreException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores job records as JSON in the key-value store.
 *
 * Store outages and unreadable records surface as {@link EngineFaultException}.
 */
@Slf4j
public class JobRepository {

    private static final String KEY_PREFIX = "job:";

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;

    public JobRepository(KeyValueStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    public void save(Job job, Duration ttl) {
        try {
            store.set(KEY_PREFIX + job.getJobId(), objectMapper.writeValueAsString(job), ttl);
            log.debug("Saved job {} in {} status", job.getJobId(), job.getStatus());
        } catch (JsonProcessingException e) {
            throw new EngineFaultException("Job " + job.getJobId() + " could not be serialized", e);
        } catch (KeyValueStoreException e) {
            throw new EngineFaultException("Job " + job.getJobId() + " could not be persisted", e);
        }
    }

    public Optional<Job> findById(UUID jobId) {
        Optional<String> json;
        try {
            json = store.get(KEY_PREFIX + jobId);
        } catch (KeyValueStoreException e) {
            throw new EngineFaultException("Job " + jobId + " could not be read", e);
        }
        if (json.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json.get(), Job.class));
        } catch (JsonProcessingException e) {
            throw new EngineFaultException("Job record " + jobId + " is corrupted", e);
        }
    }
}
