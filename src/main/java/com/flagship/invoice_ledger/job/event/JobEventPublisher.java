package com.flagship.invoice_ledger.job.event;

/**
 * Announces terminal job transitions. Publishing is best effort and never fails the job.
 */
public interface JobEventPublisher {

    void publish(JobEvent event);
}
