package com.flagship.invoice_ledger.extraction;

import com.flagship.invoice_ledger.observability.ExtractionMetrics;
import com.flagship.invoice_ledger.provider.ImagePayload;
import com.flagship.invoice_ledger.provider.InferenceProvider;
import com.flagship.invoice_ledger.provider.ProviderOutcome;
import com.flagship.invoice_ledger.provider.ProviderRegistry;
import com.flagship.invoice_ledger.provider.ProviderSelection;
import com.flagship.invoice_ledger.provider.TransientProviderException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Submits invoice documents to inference providers and turns the answers into
 * {@link ExtractionResult}s.
 *
 * Flow per file (or per batch of cache misses):
 * 1. Content cache lookup unless bypassed
 * 2. Provider selection through the {@link ProviderRegistry}, failing over on transient errors
 * 3. Defensive parsing of the returned text
 * 4. Cache write for successful, non-bypassed extractions
 *
 * Per-file problems always come back as FAILED results; this class never throws for them.
 */
@Slf4j
public class ExtractionClient {

    public static final String ALL_PROVIDERS_EXHAUSTED = "all providers exhausted";
    public static final String UNPARSEABLE_RESPONSE = ProviderResponseParser.UNPARSEABLE;

    private final ProviderRegistry registry;
    private final ContentCache cache;
    private final ProviderResponseParser parser;
    private final ExecutorService callExecutor;
    private final ExtractionMetrics metrics;
    private final Duration callTimeout;
    private final int maxAttempts;

    public ExtractionClient(ProviderRegistry registry,
                            ContentCache cache,
                            ProviderResponseParser parser,
                            ExecutorService callExecutor,
                            ExtractionMetrics metrics,
                            Duration callTimeout,
                            int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.registry = registry;
        this.cache = cache;
        this.parser = parser;
        this.callExecutor = callExecutor;
        this.metrics = metrics;
        this.callTimeout = callTimeout;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Extracts one file.
     *
     * @param file document to extract
     * @param contentHash fingerprint of the file bytes, see {@link ContentFingerprint}
     * @param bypassCache skip both the cache lookup and the cache write
     */
    public ExtractionResult extract(SourceFile file, String contentHash, boolean bypassCache) {
        if (!bypassCache) {
            var cached = cache.get(contentHash);
            if (cached.isPresent()) {
                metrics.recordCacheHit();
                log.debug("Cache hit for file {} ({})", file.getFileId(), contentHash);
                return record(ExtractionResult.cached(
                    file.getFileId(), cached.get().getFields(), cached.get().getProviderId()));
            }
            metrics.recordCacheMiss();
        }
        return record(extractUncached(file, contentHash, bypassCache));
    }

    /**
     * Extracts a group of files, sending every cache miss in a single provider call.
     *
     * @return one result per file, in the order of {@code files}
     */
    public List<ExtractionResult> extractBatch(List<SourceFile> files, boolean bypassCache) {
        List<ExtractionResult> results = new ArrayList<>(Collections.nCopies(files.size(), null));
        List<Integer> misses = new ArrayList<>();
        List<String> hashes = new ArrayList<>(files.size());

        for (int i = 0; i < files.size(); i++) {
            SourceFile file = files.get(i);
            String hash = ContentFingerprint.of(file.getData());
            hashes.add(hash);
            if (!bypassCache) {
                var cached = cache.get(hash);
                if (cached.isPresent()) {
                    metrics.recordCacheHit();
                    results.set(i, record(ExtractionResult.cached(
                        file.getFileId(), cached.get().getFields(), cached.get().getProviderId())));
                    continue;
                }
                metrics.recordCacheMiss();
            }
            misses.add(i);
        }

        if (misses.size() == 1) {
            int index = misses.get(0);
            results.set(index, record(extractUncached(files.get(index), hashes.get(index), bypassCache)));
        } else if (misses.size() > 1) {
            List<ImagePayload> payloads = new ArrayList<>(misses.size());
            for (int index : misses) {
                payloads.add(files.get(index).toPayload());
            }
            CallOutcome call = invokeWithFailover(payloads, ExtractionPrompts.batch(payloads.size()));
            if (!call.succeeded()) {
                for (int index : misses) {
                    results.set(index, record(ExtractionResult.failed(files.get(index).getFileId(), call.error(), null)));
                }
            } else {
                List<ProviderResponseParser.ParsedResponse> parsed = parser.parseBatch(call.text(), misses.size());
                for (int j = 0; j < misses.size(); j++) {
                    int index = misses.get(j);
                    results.set(index, record(toResult(
                        files.get(index), hashes.get(index), bypassCache, call.providerId(), parsed.get(j))));
                }
            }
        }
        return results;
    }

    private ExtractionResult extractUncached(SourceFile file, String contentHash, boolean bypassCache) {
        CallOutcome call = invokeWithFailover(List.of(file.toPayload()), ExtractionPrompts.singleInvoice());
        if (!call.succeeded()) {
            return ExtractionResult.failed(file.getFileId(), call.error(), null);
        }
        return toResult(file, contentHash, bypassCache, call.providerId(), parser.parseSingle(call.text()));
    }

    private ExtractionResult toResult(SourceFile file, String contentHash, boolean bypassCache,
                                      String providerId, ProviderResponseParser.ParsedResponse parsed) {
        if (!parsed.isSuccess()) {
            log.warn("Provider {} answer for file {} rejected: {}", providerId, file.getFileId(), parsed.getError());
            return ExtractionResult.failed(file.getFileId(), parsed.getError(), providerId);
        }
        if (!bypassCache) {
            cache.put(contentHash, parsed.getFields(), providerId);
        }
        return ExtractionResult.success(file.getFileId(), parsed.getFields(), providerId);
    }

    private CallOutcome invokeWithFailover(List<ImagePayload> payloads, String instruction) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            ProviderSelection selection = registry.selectProvider();
            if (selection.isExhausted()) {
                metrics.recordProvidersExhausted();
                log.warn("No provider available for {} image(s) after {} attempt(s)", payloads.size(), attempt - 1);
                return CallOutcome.failed(ALL_PROVIDERS_EXHAUSTED);
            }

            InferenceProvider provider = selection.provider();
            long startNanos = System.nanoTime();
            try {
                String text = invokeWithTimeout(provider, payloads, instruction);
                registry.recordOutcome(provider.getId(), ProviderOutcome.SUCCESS, null);
                metrics.recordProviderCall(provider.getId(), "success", elapsedSince(startNanos));
                return CallOutcome.succeeded(provider.getId(), text);

            } catch (TransientProviderException e) {
                ProviderOutcome outcome = e.isQuotaExceeded()
                    ? ProviderOutcome.QUOTA_EXCEEDED
                    : ProviderOutcome.TRANSIENT_FAILURE;
                registry.recordOutcome(provider.getId(), outcome, e.getMessage());
                metrics.recordProviderCall(provider.getId(), outcome.name(), elapsedSince(startNanos));
                log.warn("Provider {} failed on attempt {}/{}: outcome={}, error={}",
                    provider.getId(), attempt, maxAttempts, outcome, e.getMessage());

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                registry.recordOutcome(provider.getId(), ProviderOutcome.TRANSIENT_FAILURE, "interrupted");
                log.warn("Extraction interrupted while waiting for provider {}", provider.getId());
                return CallOutcome.failed("extraction interrupted");
            }
        }
        log.warn("Gave up after {} provider attempts", maxAttempts);
        return CallOutcome.failed(ALL_PROVIDERS_EXHAUSTED);
    }

    private String invokeWithTimeout(InferenceProvider provider, List<ImagePayload> payloads, String instruction)
            throws InterruptedException {
        Future<String> future = callExecutor.submit(() -> provider.invoke(payloads, instruction, callTimeout));
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientProviderException(provider.getId(),
                "timed out after " + callTimeout.toMillis() + "ms", false, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (CancellationException e) {
            throw new TransientProviderException(provider.getId(), "call cancelled", false, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TransientProviderException transientFailure) {
                throw transientFailure;
            }
            throw new TransientProviderException(provider.getId(),
                "unexpected provider error: " + cause, false, cause);
        }
    }

    private ExtractionResult record(ExtractionResult result) {
        metrics.recordExtraction(result.getStatus().name());
        return result;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private record CallOutcome(String providerId, String text, String error) {

        static CallOutcome succeeded(String providerId, String text) {
            return new CallOutcome(providerId, text, null);
        }

        static CallOutcome failed(String error) {
            return new CallOutcome(null, null, error);
        }

        boolean succeeded() {
            return error == null;
        }
    }
}
