package com.flagship.invoice_ledger.job;

import com.flagship.invoice_ledger.config.JobProperties;
import com.flagship.invoice_ledger.extraction.ContentFingerprint;
import com.flagship.invoice_ledger.extraction.ExtractionClient;
import com.flagship.invoice_ledger.extraction.ExtractionResult;
import com.flagship.invoice_ledger.extraction.SourceFile;
import com.flagship.invoice_ledger.job.event.JobCompletedEvent;
import com.flagship.invoice_ledger.job.event.JobEventPublisher;
import com.flagship.invoice_ledger.job.event.JobFailedEvent;
import com.flagship.invoice_ledger.ledger.LedgerDocument;
import com.flagship.invoice_ledger.ledger.LedgerSynthesisService;
import com.flagship.invoice_ledger.observability.CorrelationContext;
import com.flagship.invoice_ledger.observability.ExtractionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.function.UnaryOperator;

/**
 * Runs extraction jobs in the background and tracks their progress.
 *
 * Flow:
 * 1. {@link #createJob} validates input, stores a PENDING job and hands it to the job executor
 * 2. The worker moves the job to PROCESSING and extracts files batch by batch,
 *    storing each result at the file's original index
 * 3. With every file processed the job becomes COMPLETED, whatever the per-file outcomes
 * 4. Store failures, unexpected worker errors and the overall timeout make it FAILED
 *
 * Writes to one job record are serialized on the job's handle, and a terminal
 * record is never overwritten. Callers poll with {@link #getJobStatus}.
 */
@Slf4j
public class JobService {

    public static final Set<String> ALLOWED_MIME_TYPES = Set.of(
        "image/jpeg", "image/png", "image/webp", "application/pdf");

    private final JobRepository repository;
    private final ExtractionClient extractionClient;
    private final LedgerSynthesisService ledgerSynthesis;
    private final JobEventPublisher eventPublisher;
    private final ExtractionMetrics metrics;
    private final JobProperties properties;
    private final AsyncTaskExecutor jobExecutor;
    private final Clock clock;

    private final Map<UUID, ActiveJob> activeJobs = new ConcurrentHashMap<>();

    public JobService(JobRepository repository,
                      ExtractionClient extractionClient,
                      LedgerSynthesisService ledgerSynthesis,
                      JobEventPublisher eventPublisher,
                      ExtractionMetrics metrics,
                      JobProperties properties,
                      AsyncTaskExecutor jobExecutor,
                      Clock clock) {
        if (properties.getBatchSize() < 1) {
            throw new IllegalArgumentException("jobs.batch-size must be at least 1");
        }
        this.repository = repository;
        this.extractionClient = extractionClient;
        this.ledgerSynthesis = ledgerSynthesis;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.properties = properties;
        this.jobExecutor = jobExecutor;
        this.clock = clock;
        metrics.registerActiveJobsGauge(activeJobs::size);
    }

    /**
     * Creates a job and starts processing it in the background.
     *
     * @param files validated documents in submission order
     * @param companyName company the ledger is generated for
     * @param transactionType sales or purchase
     * @param bypassCache skip cache reads and writes for this job
     * @return the new job id
     * @throws IllegalArgumentException for empty, oversized or otherwise invalid input
     * @throws EngineFaultException if the job record cannot be stored
     */
    public UUID createJob(List<SourceFile> files, String companyName,
                          TransactionType transactionType, boolean bypassCache) {
        validate(files, companyName, transactionType);

        Job job = Job.create(UUID.randomUUID(), files.size(), companyName.trim(),
            transactionType, bypassCache, clock.instant());
        repository.save(job, activeTtl());

        ActiveJob handle = new ActiveJob(job, job.getCreatedAt().plus(properties.getTimeout()));
        activeJobs.put(job.getJobId(), handle);
        metrics.recordJobCreated(transactionType.getDisplayName(), files.size());

        String correlationId = MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY);
        List<SourceFile> snapshot = List.copyOf(files);
        try {
            handle.future = jobExecutor.submit(() -> process(handle, snapshot, correlationId));
        } catch (TaskRejectedException e) {
            log.error("Job executor rejected job {}", job.getJobId(), e);
            activeJobs.remove(job.getJobId());
            fail(handle, "job queue is full");
        }

        log.info("Job created: jobId={}, files={}, type={}, company={}, bypassCache={}",
            job.getJobId(), files.size(), transactionType, job.getCompanyName(), bypassCache);
        return job.getJobId();
    }

    /**
     * Reads the stored job.
     *
     * @throws JobNotFoundException if the id is unknown or the job has expired
     */
    public Job getJobStatus(UUID jobId) {
        return repository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * Returns the job if it has COMPLETED.
     *
     * @throws LedgerNotReadyException if the job is in any other state
     */
    public Job getCompletedJob(UUID jobId) {
        Job job = getJobStatus(jobId);
        if (job.getStatus() != JobStatus.COMPLETED) {
            throw new LedgerNotReadyException(jobId, job.getStatus());
        }
        return job;
    }

    public LedgerDocument getLedgerDocument(UUID jobId) {
        return ledgerSynthesis.synthesize(getCompletedJob(jobId));
    }

    /**
     * Fails every running job whose deadline has passed and cancels its worker.
     *
     * @return number of jobs failed
     */
    public int failOverdueJobs() {
        Instant now = clock.instant();
        int failed = 0;
        for (ActiveJob handle : activeJobs.values()) {
            if (now.isAfter(handle.deadline) && fail(handle, timeoutReason())) {
                Future<?> future = handle.future;
                if (future != null) {
                    future.cancel(true);
                }
                activeJobs.remove(handle.current.getJobId());
                failed++;
            }
        }
        if (failed > 0) {
            log.warn("Timeout sweep failed {} overdue job(s)", failed);
        }
        return failed;
    }

    public int activeJobCount() {
        return activeJobs.size();
    }

    private void process(ActiveJob handle, List<SourceFile> files, String correlationId) {
        UUID jobId = handle.current.getJobId();
        MDC.put(CorrelationContext.JOB_ID_MDC_KEY, jobId.toString());
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY,
            correlationId != null ? correlationId : CorrelationContext.generateCorrelationId());
        long startTime = System.currentTimeMillis();
        boolean bypassCache = handle.current.isBypassCache();

        try {
            if (!update(handle, job -> job.startProcessing(clock.instant()))) {
                return;
            }
            log.info("Job processing started: files={}, batchSize={}", files.size(), properties.getBatchSize());

            for (int start = 0; start < files.size(); start += properties.getBatchSize()) {
                if (clock.instant().isAfter(handle.deadline)) {
                    fail(handle, timeoutReason());
                    return;
                }
                if (Thread.currentThread().isInterrupted()) {
                    fail(handle, "job interrupted");
                    return;
                }
                List<SourceFile> batch = files.subList(start, Math.min(start + properties.getBatchSize(), files.size()));
                List<ExtractionResult> results = batch.size() == 1
                    ? List.of(extractionClient.extract(batch.get(0), ContentFingerprint.of(batch.get(0).getData()), bypassCache))
                    : extractionClient.extractBatch(batch, bypassCache);

                for (int offset = 0; offset < results.size(); offset++) {
                    int index = start + offset;
                    ExtractionResult result = results.get(offset);
                    if (!update(handle, job -> job.withResult(index, result, clock.instant()))) {
                        return;
                    }
                }
                log.debug("Batch done: files {}-{} of {}", start + 1, start + batch.size(), files.size());
            }

            if (update(handle, job -> job.complete(clock.instant()))) {
                Job completed = handle.current;
                long duration = System.currentTimeMillis() - startTime;
                log.info("Job completed: successful={}, failed={}, durationMs={}",
                    completed.getSuccessfulCount(), completed.getFailedCount(), duration);
                metrics.recordJobFinished(JobStatus.COMPLETED.name(), Duration.ofMillis(duration));
                eventPublisher.publish(JobCompletedEvent.fromJob(completed));
            }

        } catch (EngineFaultException e) {
            log.error("Engine fault while processing job: {}", e.getMessage(), e);
            fail(handle, "engine fault: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error while processing job", e);
            fail(handle, "unexpected engine error: " + e.getMessage());
        } finally {
            activeJobs.remove(jobId);
            MDC.remove(CorrelationContext.JOB_ID_MDC_KEY);
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }

    /**
     * Applies a transition and persists it, unless the job has already reached a terminal state.
     *
     * @return false if the job was terminal and nothing was written
     */
    private boolean update(ActiveJob handle, UnaryOperator<Job> transition) {
        synchronized (handle) {
            if (handle.current.isTerminal()) {
                log.debug("Job {} is already {}, update skipped", handle.current.getJobId(), handle.current.getStatus());
                return false;
            }
            Job next = transition.apply(handle.current);
            repository.save(next, next.isTerminal() ? properties.getRetention() : activeTtl());
            handle.current = next;
            return true;
        }
    }

    /**
     * Forces the job to FAILED. A store error here is logged; the in-memory state still
     * becomes terminal so no later write can revive the job.
     *
     * @return true if this call made the job FAILED
     */
    private boolean fail(ActiveJob handle, String reason) {
        Job failed;
        String previousStatus;
        synchronized (handle) {
            if (handle.current.isTerminal()) {
                return false;
            }
            previousStatus = handle.current.getStatus().name();
            failed = handle.current.fail(reason, clock.instant());
            handle.current = failed;
            try {
                repository.save(failed, properties.getRetention());
            } catch (EngineFaultException e) {
                log.error("Could not persist FAILED status for job {}: {}", failed.getJobId(), e.getMessage(), e);
            }
        }
        log.warn("Job failed: jobId={}, previousStatus={}, reason={}", failed.getJobId(), previousStatus, reason);
        metrics.recordJobFinished(JobStatus.FAILED.name(), Duration.between(failed.getCreatedAt(), failed.getUpdatedAt()));
        eventPublisher.publish(JobFailedEvent.fromJob(failed, previousStatus));
        return true;
    }

    private void validate(List<SourceFile> files, String companyName, TransactionType transactionType) {
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("At least one file is required");
        }
        if (files.size() > properties.getMaxFiles()) {
            throw new IllegalArgumentException(
                "Too many files: " + files.size() + " (maximum " + properties.getMaxFiles() + ")");
        }
        if (companyName == null || companyName.isBlank()) {
            throw new IllegalArgumentException("Company name is required");
        }
        if (transactionType == null) {
            throw new IllegalArgumentException("Transaction type is required");
        }
        List<String> rejected = new ArrayList<>();
        for (SourceFile file : files) {
            Objects.requireNonNull(file, "file");
            if (file.getData() == null || file.getData().length == 0) {
                rejected.add(file.getFileId() + " (empty)");
            } else if (file.getMimeType() == null || !ALLOWED_MIME_TYPES.contains(file.getMimeType())) {
                rejected.add(file.getFileId() + " (" + file.getMimeType() + ")");
            }
        }
        if (!rejected.isEmpty()) {
            throw new IllegalArgumentException("Unsupported files: " + String.join(", ", rejected)
                + ". Allowed types: image/jpeg, image/png, image/webp, application/pdf");
        }
    }

    private Duration activeTtl() {
        return properties.getTimeout().plus(properties.getRetention());
    }

    private String timeoutReason() {
        return "job timed out after " + properties.getTimeout();
    }

    private static final class ActiveJob {
        volatile Job current;
        volatile Future<?> future;
        final Instant deadline;

        ActiveJob(Job current, Instant deadline) {
            this.current = current;
            this.deadline = deadline;
        }
    }
}
