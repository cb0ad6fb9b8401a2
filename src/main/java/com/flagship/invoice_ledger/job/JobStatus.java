package com.flagship.invoice_ledger.job;

/**
 * Lifecycle of an extraction job.
 *
 * PENDING → PROCESSING → COMPLETED / FAILED. Terminal states never change.
 */
public enum JobStatus {
    /**
     * Job is stored and queued; no provider call has been made yet.
     */
    PENDING,

    /**
     * At least one batch has been dispatched.
     */
    PROCESSING,

    /**
     * Every file has a result, successful or not.
     * Terminal state - no further transitions allowed.
     */
    COMPLETED,

    /**
     * Engine fault or overall timeout. Per-file failures never lead here.
     * Terminal state - no further transitions allowed.
     */
    FAILED
}
