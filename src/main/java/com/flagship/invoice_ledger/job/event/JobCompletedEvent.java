package com.flagship.invoice_ledger.job.event;

import com.flagship.invoice_ledger.job.Job;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a job reaches COMPLETED. Per-file failures are counted, not listed.
 */
@Value
public class JobCompletedEvent implements JobEvent {
    UUID eventId;
    UUID jobId;
    String companyName;
    String transactionType;
    int totalFiles;
    int successfulFiles;
    int failedFiles;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JobCompleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static JobCompletedEvent fromJob(Job job) {
        return new JobCompletedEvent(
            UUID.randomUUID(),
            job.getJobId(),
            job.getCompanyName(),
            job.getTransactionType().getDisplayName(),
            job.getFileCount(),
            job.getSuccessfulCount(),
            job.getFailedCount(),
            job.getUpdatedAt()
        );
    }
}
