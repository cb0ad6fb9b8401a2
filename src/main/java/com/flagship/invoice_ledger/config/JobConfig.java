package com.flagship.invoice_ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.invoice_ledger.extraction.ExtractionClient;
import com.flagship.invoice_ledger.job.JobRepository;
import com.flagship.invoice_ledger.job.JobService;
import com.flagship.invoice_ledger.job.event.JobEventPublisher;
import com.flagship.invoice_ledger.job.event.LoggingJobEventPublisher;
import com.flagship.invoice_ledger.ledger.LedgerSynthesisService;
import com.flagship.invoice_ledger.observability.ExtractionMetrics;
import com.flagship.invoice_ledger.store.KeyValueStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Job engine wiring: the worker pool, the job store and the event publisher.
 */
@Configuration
@EnableScheduling
public class JobConfig {

    /**
     * Bounded pool for job workers, separate from request threads.
     */
    @Bean
    public ThreadPoolTaskExecutor jobExecutor(JobProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExecutor().getCoreSize());
        executor.setMaxPoolSize(properties.getExecutor().getMaxSize());
        executor.setQueueCapacity(properties.getExecutor().getQueueCapacity());
        executor.setThreadNamePrefix("job-");
        return executor;
    }

    @Bean
    public JobRepository jobRepository(KeyValueStore store, ObjectMapper objectMapper) {
        return new JobRepository(store, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "jobs.events.enabled", havingValue = "false", matchIfMissing = true)
    public JobEventPublisher loggingJobEventPublisher() {
        return new LoggingJobEventPublisher();
    }

    @Bean
    public JobService jobService(JobRepository jobRepository,
                                 ExtractionClient extractionClient,
                                 LedgerSynthesisService ledgerSynthesisService,
                                 JobEventPublisher jobEventPublisher,
                                 ExtractionMetrics metrics,
                                 JobProperties properties,
                                 @Qualifier("jobExecutor") ThreadPoolTaskExecutor jobExecutor,
                                 Clock clock) {
        return new JobService(jobRepository, extractionClient, ledgerSynthesisService, jobEventPublisher,
            metrics, properties, jobExecutor, clock);
    }
}
