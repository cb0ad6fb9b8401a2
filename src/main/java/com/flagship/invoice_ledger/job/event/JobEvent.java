package com.flagship.invoice_ledger.job.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for job lifecycle events.
 *
 * All job events share:
 * - Event ID for deduplication
 * - Job ID (used as the message key)
 * - Timestamp of when the event occurred
 */
public interface JobEvent {

    UUID getEventId();

    UUID getJobId();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
