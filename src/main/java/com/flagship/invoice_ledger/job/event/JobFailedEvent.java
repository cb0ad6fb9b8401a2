package com.flagship.invoice_ledger.job.event;

import com.flagship.invoice_ledger.job.Job;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a job is aborted by an engine fault or by the overall timeout.
 */
@Value
public class JobFailedEvent implements JobEvent {
    UUID eventId;
    UUID jobId;
    String failureReason;
    String previousStatus;
    int processedFiles;
    int totalFiles;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JobFailed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static JobFailedEvent fromJob(Job job, String previousStatus) {
        return new JobFailedEvent(
            UUID.randomUUID(),
            job.getJobId(),
            job.getFailureReason(),
            previousStatus,
            job.getProcessedCount(),
            job.getFileCount(),
            job.getUpdatedAt()
        );
    }
}
