package com.flagship.invoice_ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Binds the {@code jobs} section of application.yml.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "jobs")
public class JobProperties {

    /** Files per provider call. 1 disables grouping. */
    @Min(1)
    private int batchSize = 1;

    /** Overall processing budget; overdue jobs are forced to FAILED. */
    @NotNull
    private Duration timeout = Duration.ofMinutes(30);

    /** How long terminal jobs stay readable. */
    @NotNull
    private Duration retention = Duration.ofHours(24);

    @Min(1)
    private int maxFiles = 50;

    @Valid
    private Executor executor = new Executor();

    @Valid
    private Events events = new Events();

    @Getter
    @Setter
    public static class Executor {
        @Min(1)
        private int coreSize = 4;
        @Min(1)
        private int maxSize = 8;
        @Min(0)
        private int queueCapacity = 100;
    }

    @Getter
    @Setter
    public static class Events {
        private boolean enabled = false;
        @NotBlank
        private String topic = "invoice-jobs";
    }
}
