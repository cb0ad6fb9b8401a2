package com.flagship.invoice_ledger.job;

import java.util.UUID;

/**
 * The ledger was requested for a job that has not reached COMPLETED.
 */
public class LedgerNotReadyException extends RuntimeException {

    public LedgerNotReadyException(UUID jobId, JobStatus status) {
        super(String.format("Ledger for job %s is not ready: job is %s", jobId, status));
    }
}
