package com.flagship.invoice_ledger.job.event;

import lombok.extern.slf4j.Slf4j;

/**
 * Default publisher when Kafka events are switched off: the event only goes to the log.
 */
@Slf4j
public class LoggingJobEventPublisher implements JobEventPublisher {

    @Override
    public void publish(JobEvent event) {
        log.info("Job event: eventType={}, jobId={}, eventId={}",
            event.getEventType(), event.getJobId(), event.getEventId());
    }
}
