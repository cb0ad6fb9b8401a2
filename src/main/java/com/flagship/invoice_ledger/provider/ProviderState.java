package com.flagship.invoice_ledger.provider;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;

/**
 * Read-only snapshot of one provider's quota and health.
 */
@Value
public class ProviderState {

    @JsonProperty("provider_id")
    String providerId;

    @JsonProperty("priority_rank")
    int priorityRank;

    @JsonProperty("daily_quota")
    int dailyQuota;

    @JsonProperty("calls_used_today")
    int callsUsedToday;

    @JsonProperty("cooldown_until")
    Instant cooldownUntil;

    @JsonProperty("consecutive_failures")
    int consecutiveFailures;

    @JsonProperty("last_error")
    String lastError;

    @JsonProperty("available")
    boolean available;
}
