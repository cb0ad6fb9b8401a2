package com.flagship.invoice_ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds the {@code extraction} section of application.yml: provider list,
 * quota policy, call limits and cache lifetime.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "extraction")
public class ExtractionProperties {

    /** Upper bound for a single provider call. */
    @NotNull
    private Duration callTimeout = Duration.ofSeconds(60);

    /** Provider attempts per file (or per batch) before giving up. */
    @Min(1)
    private int maxAttempts = 6;

    /** Threads available for concurrent provider calls across all jobs. */
    @Min(1)
    private int callConcurrency = 8;

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Quota quota = new Quota();

    /** Providers in priority order; the first entry is tried first. */
    @NotEmpty
    @Valid
    private List<ProviderSettings> providers = new ArrayList<>();

    @Getter
    @Setter
    public static class Cache {
        @NotNull
        private Duration ttl = Duration.ofDays(7);
    }

    @Getter
    @Setter
    public static class Quota {
        /** Zone whose midnight resets the daily provider quotas. */
        private ZoneId resetZone = ZoneId.of("America/Los_Angeles");
        /** Consecutive transient failures tolerated before cooldown starts. */
        @Min(1)
        private int failureThreshold = 3;
        private Duration baseBackoff = Duration.ofSeconds(30);
        private Duration maxBackoff = Duration.ofMinutes(15);
    }

    @Getter
    @Setter
    public static class ProviderSettings {
        /** Identifier reported in results, e.g. "gemini-2.5-flash". */
        @NotBlank
        private String id;
        /** Implementation type; "gemini" is built in. */
        private String type = "gemini";
        private String model;
        private String apiKey;
        private String baseUrl = "https://generativelanguage.googleapis.com";
        @Min(1)
        private int dailyQuota = 250;
    }
}
