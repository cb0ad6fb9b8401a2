package com.flagship.invoice_ledger.job;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.invoice_ledger.extraction.ExtractionResult;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Extraction job over an ordered set of files.
 *
 * Key principles:
 * - Status transitions are explicit and validated
 * - State changes are immutable (each transition returns a new Job)
 * - {@code results} has one slot per file in submission order; an empty slot is a file not yet processed
 */
@Value
public class Job {
    UUID jobId;
    JobStatus status;
    Instant createdAt;
    Instant updatedAt;
    int fileCount;
    List<ExtractionResult> results;
    String companyName;
    TransactionType transactionType;
    boolean bypassCache;
    String failureReason;

    /**
     * Creates a new Job in PENDING status.
     */
    public static Job create(UUID jobId, int fileCount, String companyName,
                             TransactionType transactionType, boolean bypassCache, Instant now) {
        if (fileCount < 1) {
            throw new IllegalArgumentException("A job needs at least one file");
        }
        return new Job(
            jobId,
            JobStatus.PENDING,
            now,
            now,
            fileCount,
            Collections.unmodifiableList(new ArrayList<>(Collections.nCopies(fileCount, null))),
            companyName,
            transactionType,
            bypassCache,
            null
        );
    }

    /**
     * Transitions to PROCESSING. Only valid from PENDING; a PROCESSING job is returned unchanged.
     *
     * @throws IllegalStateException if the job is terminal
     */
    public Job startProcessing(Instant now) {
        if (status == JobStatus.PROCESSING) {
            return this;
        }
        if (status != JobStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Cannot start job %s in %s status. Only PENDING jobs can start.", jobId, status));
        }
        return new Job(jobId, JobStatus.PROCESSING, createdAt, now, fileCount, results,
            companyName, transactionType, bypassCache, null);
    }

    /**
     * Records the result for the file at {@code index}.
     *
     * @throws IllegalStateException if the job is not PROCESSING or the slot is already filled
     */
    public Job withResult(int index, ExtractionResult result, Instant now) {
        Objects.requireNonNull(result, "result");
        if (status != JobStatus.PROCESSING) {
            throw new IllegalStateException(
                String.format("Cannot record results on job %s in %s status", jobId, status));
        }
        if (index < 0 || index >= fileCount) {
            throw new IllegalArgumentException("File index " + index + " out of range for " + fileCount + " files");
        }
        if (results.get(index) != null) {
            throw new IllegalStateException("Result for file " + index + " already recorded on job " + jobId);
        }
        List<ExtractionResult> updated = new ArrayList<>(results);
        updated.set(index, result);
        return new Job(jobId, status, createdAt, now, fileCount, Collections.unmodifiableList(updated),
            companyName, transactionType, bypassCache, null);
    }

    /**
     * Transitions to COMPLETED. Valid from PROCESSING once every file has a result.
     *
     * @throws IllegalStateException if results are missing or the job is not PROCESSING
     */
    public Job complete(Instant now) {
        if (status != JobStatus.PROCESSING) {
            throw new IllegalStateException(
                String.format("Cannot complete job %s in %s status. Only PROCESSING jobs can complete.",
                    jobId, status));
        }
        if (getProcessedCount() != fileCount) {
            throw new IllegalStateException(
                String.format("Cannot complete job %s: %d of %d files processed", jobId, getProcessedCount(), fileCount));
        }
        return new Job(jobId, JobStatus.COMPLETED, createdAt, now, fileCount, results,
            companyName, transactionType, bypassCache, null);
    }

    /**
     * Transitions to FAILED. Valid from PENDING or PROCESSING.
     *
     * @throws IllegalStateException if the job is terminal
     */
    public Job fail(String reason, Instant now) {
        if (isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot fail job %s in %s status. Job is already terminal.", jobId, status));
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Failure reason is required");
        }
        return new Job(jobId, JobStatus.FAILED, createdAt, now, fileCount, results,
            companyName, transactionType, bypassCache, reason);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status == JobStatus.COMPLETED || status == JobStatus.FAILED;
    }

    @JsonIgnore
    public int getProcessedCount() {
        return (int) results.stream().filter(Objects::nonNull).count();
    }

    @JsonIgnore
    public int getSuccessfulCount() {
        return (int) results.stream().filter(r -> r != null && r.isSuccess()).count();
    }

    @JsonIgnore
    public int getFailedCount() {
        return getProcessedCount() - getSuccessfulCount();
    }

    /**
     * Checks if a transition from the current status to the target status is allowed.
     */
    public boolean canTransitionTo(JobStatus target) {
        if (status == target) {
            return status == JobStatus.PROCESSING;
        }
        return switch (status) {
            case PENDING -> target == JobStatus.PROCESSING || target == JobStatus.FAILED;
            case PROCESSING -> target == JobStatus.COMPLETED || target == JobStatus.FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
