package com.flagship.invoice_ledger.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.invoice_ledger.config.ExtractionProperties;
import com.flagship.invoice_ledger.config.JacksonConfig;
import com.flagship.invoice_ledger.config.JobProperties;
import com.flagship.invoice_ledger.extraction.ContentCache;
import com.flagship.invoice_ledger.extraction.ExtractionClient;
import com.flagship.invoice_ledger.extraction.ExtractionResult;
import com.flagship.invoice_ledger.extraction.ExtractionStatus;
import com.flagship.invoice_ledger.extraction.ProviderResponseParser;
import com.flagship.invoice_ledger.extraction.SourceFile;
import com.flagship.invoice_ledger.job.event.JobCompletedEvent;
import com.flagship.invoice_ledger.job.event.JobEvent;
import com.flagship.invoice_ledger.job.event.JobFailedEvent;
import com.flagship.invoice_ledger.ledger.LedgerSynthesisService;
import com.flagship.invoice_ledger.observability.ExtractionMetrics;
import com.flagship.invoice_ledger.provider.InferenceProvider;
import com.flagship.invoice_ledger.provider.ProviderRegistry;
import com.flagship.invoice_ledger.store.InMemoryKeyValueStore;
import com.flagship.invoice_ledger.store.KeyValueStore;
import com.flagship.invoice_ledger.store.KeyValueStoreException;
import com.flagship.invoice_ledger.support.MutableClock;
import com.flagship.invoice_ledger.support.ScriptedProvider;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class JobServiceTest {

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-15T10:00:00Z"));
    private final List<JobEvent> events = new CopyOnWriteArrayList<>();

    private ThreadPoolTaskExecutor jobExecutor;
    private ExecutorService callExecutor;
    private JobProperties properties;

    @BeforeEach
    void setUp() {
        jobExecutor = new ThreadPoolTaskExecutor();
        jobExecutor.setCorePoolSize(2);
        jobExecutor.setMaxPoolSize(2);
        jobExecutor.setThreadNamePrefix("test-job-");
        jobExecutor.initialize();
        callExecutor = Executors.newCachedThreadPool();

        properties = new JobProperties();
        properties.setTimeout(Duration.ofMinutes(1));
        properties.setMaxFiles(10);
    }

    @AfterEach
    void tearDown() {
        jobExecutor.shutdown();
        callExecutor.shutdownNow();
    }

    private JobService service(KeyValueStore store, InferenceProvider... providers) {
        List<ProviderRegistry.Registration> registrations = new ArrayList<>();
        for (InferenceProvider provider : providers) {
            registrations.add(ProviderRegistry.Registration.of(provider, 1000));
        }
        ProviderRegistry registry = new ProviderRegistry(registrations, new ExtractionProperties.Quota(), clock);
        ExtractionMetrics metrics = new ExtractionMetrics(new SimpleMeterRegistry());
        ExtractionClient client = new ExtractionClient(registry,
                new ContentCache(store, objectMapper, Duration.ofDays(7), clock),
                new ProviderResponseParser(objectMapper), callExecutor, metrics, Duration.ofSeconds(5), 3);
        return new JobService(new JobRepository(store, objectMapper), client, new LedgerSynthesisService(),
                events::add, metrics, properties, jobExecutor, clock);
    }

    private JobService service(InferenceProvider... providers) {
        return service(new InMemoryKeyValueStore(clock), providers);
    }

    private static List<SourceFile> files(String... contents) {
        List<SourceFile> files = new ArrayList<>();
        for (String content : contents) {
            files.add(new SourceFile(content + ".png", content.getBytes(StandardCharsets.UTF_8), "image/png"));
        }
        return files;
    }

    private static Job awaitTerminal(JobService service, UUID jobId) {
        await(() -> service.getJobStatus(jobId).isTerminal());
        return service.getJobStatus(jobId);
    }

    private static void await(BooleanSupplier condition) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within 10 seconds");
            }
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted while waiting");
            }
        }
    }

    @Test
    @DisplayName("Should process files in batches and keep results in submission order")
    void keepsSubmissionOrder() {
        properties.setBatchSize(2);
        ScriptedProvider provider = ScriptedProvider.echoingInvoiceNumbers("stub");
        JobService service = service(provider);

        UUID jobId = service.createJob(files("INV-1", "INV-2", "INV-3", "INV-4", "INV-5"),
                "Flagship Pvt Ltd", TransactionType.SALES, false);
        Job job = awaitTerminal(service, jobId);

        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(List.of("INV-1", "INV-2", "INV-3", "INV-4", "INV-5"), job.getResults().stream()
                .map(result -> result.getFields().getInvoiceNumber())
                .toList());
        assertEquals(List.of("INV-1.png", "INV-2.png", "INV-3.png", "INV-4.png", "INV-5.png"), job.getResults().stream()
                .map(ExtractionResult::getSourceFileId)
                .toList());
        assertEquals(3, provider.calls());
        await(() -> events.size() == 1);
        assertInstanceOf(JobCompletedEvent.class, events.get(0));
        assertEquals(0, service.activeJobCount());
    }

    @Test
    @DisplayName("A job whose files all fail is still COMPLETED")
    void completesWhenEveryFileFails() {
        JobService service = service(ScriptedProvider.answering("stub", "I can't read these."));

        UUID jobId = service.createJob(files("a", "b"), "Flagship Pvt Ltd", TransactionType.PURCHASE, false);
        Job job = awaitTerminal(service, jobId);

        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(2, job.getFailedCount());
        assertTrue(service.getLedgerDocument(jobId).getVouchers().isEmpty());
    }

    @Test
    @DisplayName("Files fail with all providers exhausted when every quota is spent, the job still COMPLETES")
    void completesWhenEveryProviderIsExhausted() {
        ScriptedProvider first = ScriptedProvider.quotaExhausted("first");
        ScriptedProvider second = ScriptedProvider.quotaExhausted("second");
        ScriptedProvider third = ScriptedProvider.quotaExhausted("third");
        JobService service = service(first, second, third);

        UUID jobId = service.createJob(files("a", "b"), "Flagship Pvt Ltd", TransactionType.SALES, false);
        Job job = awaitTerminal(service, jobId);

        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(2, job.getFailedCount());
        for (ExtractionResult result : job.getResults()) {
            assertEquals(ExtractionStatus.FAILED, result.getStatus());
            assertEquals(ExtractionClient.ALL_PROVIDERS_EXHAUSTED, result.getErrorDetail());
        }
        assertEquals(1, first.calls());
        assertEquals(1, second.calls());
        assertEquals(1, third.calls());
        assertEquals(2, service.getLedgerDocument(jobId).getSummary().getFailedCount());
    }

    @Test
    @DisplayName("A batch answer with too few entries fails the trailing files in place")
    void shortBatchAnswerFailsTrailingFiles() {
        properties.setBatchSize(5);
        String answer = "[" + ScriptedProvider.invoiceJson("INV-1") + "," + ScriptedProvider.invoiceJson("INV-2")
                + "," + ScriptedProvider.invoiceJson("INV-3") + "]";
        ScriptedProvider provider = ScriptedProvider.answering("stub", answer);
        JobService service = service(provider);

        UUID jobId = service.createJob(files("a", "b", "c", "d", "e"), "Flagship Pvt Ltd", TransactionType.SALES, false);
        Job job = awaitTerminal(service, jobId);

        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(1, provider.calls());
        List<ExtractionResult> results = job.getResults();
        assertEquals(List.of("a.png", "b.png", "c.png", "d.png", "e.png"), results.stream()
                .map(ExtractionResult::getSourceFileId)
                .toList());
        for (int i = 0; i < 3; i++) {
            assertEquals(ExtractionStatus.SUCCESS, results.get(i).getStatus());
            assertEquals("INV-" + (i + 1), results.get(i).getFields().getInvoiceNumber());
        }
        for (int i = 3; i < 5; i++) {
            assertEquals(ExtractionStatus.FAILED, results.get(i).getStatus());
            assertEquals("provider returned 3 entries for 5 images", results.get(i).getErrorDetail());
        }
        assertEquals(3, job.getSuccessfulCount());
        assertEquals(2, job.getFailedCount());
    }

    @Test
    @DisplayName("Overdue jobs should be failed by the sweep")
    void overdueJobsFail() {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger started = new AtomicInteger();
        ScriptedProvider blocking = new ScriptedProvider("stub", (payloads, instruction) -> {
            started.incrementAndGet();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ScriptedProvider.invoiceJson("late");
        });
        JobService service = service(blocking);

        try {
            UUID jobId = service.createJob(files("a"), "Flagship Pvt Ltd", TransactionType.SALES, false);
            await(() -> started.get() == 1);

            assertEquals(JobStatus.PROCESSING, service.getJobStatus(jobId).getStatus());
            assertThrows(LedgerNotReadyException.class, () -> service.getCompletedJob(jobId));
            assertEquals(0, service.failOverdueJobs());

            clock.advance(Duration.ofMinutes(2));
            assertEquals(1, service.failOverdueJobs());

            Job job = service.getJobStatus(jobId);
            assertEquals(JobStatus.FAILED, job.getStatus());
            assertEquals("job timed out after PT1M", job.getFailureReason());
            await(() -> events.size() == 1);
            assertInstanceOf(JobFailedEvent.class, events.get(0));
        } finally {
            release.countDown();
        }
    }

    @Test
    @DisplayName("Unknown job ids should raise JobNotFoundException")
    void unknownJob() {
        JobService service = service(ScriptedProvider.echoingInvoiceNumbers("stub"));

        assertThrows(JobNotFoundException.class, () -> service.getJobStatus(UUID.randomUUID()));
    }

    @Test
    @DisplayName("Invalid submissions should be rejected before a job is created")
    void rejectsInvalidSubmissions() {
        JobService service = service(ScriptedProvider.echoingInvoiceNumbers("stub"));

        assertThrows(IllegalArgumentException.class,
                () -> service.createJob(List.of(), "Flagship Pvt Ltd", TransactionType.SALES, false));
        assertThrows(IllegalArgumentException.class,
                () -> service.createJob(files("a"), " ", TransactionType.SALES, false));
        assertThrows(IllegalArgumentException.class,
                () -> service.createJob(files("a"), "Flagship Pvt Ltd", null, false));

        properties.setMaxFiles(2);
        assertThrows(IllegalArgumentException.class,
                () -> service.createJob(files("a", "b", "c"), "Flagship Pvt Ltd", TransactionType.SALES, false));

        List<SourceFile> textFile = List.of(
                new SourceFile("notes.txt", "hello".getBytes(StandardCharsets.UTF_8), "text/plain"));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> service.createJob(textFile, "Flagship Pvt Ltd", TransactionType.SALES, false));
        assertTrue(ex.getMessage().contains("notes.txt (text/plain)"));
        assertEquals(0, service.activeJobCount());
    }

    @Test
    @DisplayName("A store failure during processing should fail the job")
    void storeFailureFailsJob() {
        JobService service = service(new FlakyStore(new InMemoryKeyValueStore(clock), 2),
                ScriptedProvider.echoingInvoiceNumbers("stub"));

        UUID jobId = service.createJob(files("a"), "Flagship Pvt Ltd", TransactionType.SALES, false);
        Job job = awaitTerminal(service, jobId);

        assertEquals(JobStatus.FAILED, job.getStatus());
        assertTrue(job.getFailureReason().startsWith("engine fault:"));
    }

    /**
     * Delegating store whose n-th job write fails.
     */
    private static final class FlakyStore implements KeyValueStore {

        private final KeyValueStore delegate;
        private final int failingWrite;
        private final AtomicInteger jobWrites = new AtomicInteger();

        FlakyStore(KeyValueStore delegate, int failingWrite) {
            this.delegate = delegate;
            this.failingWrite = failingWrite;
        }

        @Override
        public Optional<String> get(String key) {
            return delegate.get(key);
        }

        @Override
        public void set(String key, String value, Duration ttl) {
            if (key.startsWith("job:") && jobWrites.incrementAndGet() == failingWrite) {
                throw new KeyValueStoreException("connection reset", null);
            }
            delegate.set(key, value, ttl);
        }

        @Override
        public boolean setIfAbsent(String key, String value, Duration ttl) {
            return delegate.setIfAbsent(key, value, ttl);
        }

        @Override
        public void delete(String key) {
            delegate.delete(key);
        }

        @Override
        public boolean ping() {
            return delegate.ping();
        }
    }
}
