package com.flagship.invoice_ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.invoice_ledger.extraction.ContentCache;
import com.flagship.invoice_ledger.extraction.ExtractionClient;
import com.flagship.invoice_ledger.extraction.ProviderResponseParser;
import com.flagship.invoice_ledger.observability.ExtractionMetrics;
import com.flagship.invoice_ledger.provider.GeminiInferenceProvider;
import com.flagship.invoice_ledger.provider.InferenceProvider;
import com.flagship.invoice_ledger.provider.ProviderRegistry;
import com.flagship.invoice_ledger.store.InMemoryKeyValueStore;
import com.flagship.invoice_ledger.store.KeyValueStore;
import com.flagship.invoice_ledger.store.RedisKeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Wires the extraction pipeline: store, providers, registry, cache and client.
 *
 * Providers come from {@code extraction.providers}, in priority order. Type "gemini"
 * builds a {@link GeminiInferenceProvider}; any other type is resolved to an
 * {@link InferenceProvider} bean with the same id.
 */
@Configuration
@EnableConfigurationProperties({ExtractionProperties.class, JobProperties.class})
@Slf4j
public class ExtractionConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "store.type", havingValue = "memory", matchIfMissing = true)
    public KeyValueStore inMemoryKeyValueStore(Clock clock) {
        log.info("Using in-memory key-value store; jobs and cache are lost on restart");
        return new InMemoryKeyValueStore(clock);
    }

    @Bean
    @ConditionalOnProperty(name = "store.type", havingValue = "redis")
    public KeyValueStore redisKeyValueStore(StringRedisTemplate redisTemplate) {
        log.info("Using Redis key-value store");
        return new RedisKeyValueStore(redisTemplate);
    }

    @Bean
    public ProviderRegistry providerRegistry(ExtractionProperties properties,
                                             ObjectProvider<InferenceProvider> providerBeans,
                                             RestClient.Builder restClientBuilder,
                                             Clock clock) {
        Map<String, InferenceProvider> beansById = providerBeans.orderedStream()
            .collect(Collectors.toMap(InferenceProvider::getId, Function.identity(), (first, second) -> first));

        List<ProviderRegistry.Registration> registrations = new ArrayList<>();
        for (ExtractionProperties.ProviderSettings settings : properties.getProviders()) {
            InferenceProvider provider;
            if ("gemini".equalsIgnoreCase(settings.getType())) {
                if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
                    log.error("Provider {} has no API key configured and is skipped", settings.getId());
                    continue;
                }
                RestClient.Builder builder = restClientBuilder.clone()
                    .requestFactory(ClientHttpRequestFactories.get(ClientHttpRequestFactorySettings.DEFAULTS
                        .withReadTimeout(properties.getCallTimeout())));
                provider = new GeminiInferenceProvider(settings.getId(), settings.getModel(),
                    settings.getApiKey(), builder, settings.getBaseUrl());
            } else {
                provider = beansById.get(settings.getId());
                if (provider == null) {
                    throw new IllegalArgumentException("No InferenceProvider bean with id '" + settings.getId()
                        + "' for provider type '" + settings.getType() + "'");
                }
            }
            registrations.add(ProviderRegistry.Registration.of(provider, settings.getDailyQuota()));
            log.info("Registered provider: id={}, type={}, dailyQuota={}, rank={}",
                settings.getId(), settings.getType(), settings.getDailyQuota(), registrations.size());
        }
        return new ProviderRegistry(registrations, properties.getQuota(), clock);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService providerCallExecutor(ExtractionProperties properties) {
        return Executors.newFixedThreadPool(properties.getCallConcurrency(),
            new CustomizableThreadFactory("provider-call-"));
    }

    @Bean
    public ContentCache contentCache(KeyValueStore store, ObjectMapper objectMapper,
                                     ExtractionProperties properties, Clock clock) {
        return new ContentCache(store, objectMapper, properties.getCache().getTtl(), clock);
    }

    @Bean
    public ProviderResponseParser providerResponseParser(ObjectMapper objectMapper) {
        return new ProviderResponseParser(objectMapper);
    }

    @Bean
    public ExtractionClient extractionClient(ProviderRegistry registry,
                                             ContentCache contentCache,
                                             ProviderResponseParser parser,
                                             ExecutorService providerCallExecutor,
                                             ExtractionMetrics metrics,
                                             ExtractionProperties properties) {
        return new ExtractionClient(registry, contentCache, parser, providerCallExecutor, metrics,
            properties.getCallTimeout(), properties.getMaxAttempts());
    }
}
