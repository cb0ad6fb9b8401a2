package com.flagship.invoice_ledger.job;

/**
 * The job record could not be stored or read back. Aborts the job.
 */
public class EngineFaultException extends RuntimeException {

    public EngineFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
