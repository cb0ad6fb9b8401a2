package com.flagship.invoice_ledger.provider;

/**
 * Result of a single provider call, as reported to the {@link ProviderRegistry}.
 */
public enum ProviderOutcome {
    SUCCESS,

    /**
     * Remote side reported its daily quota is used up.
     * The provider is parked until the next quota reset boundary.
     */
    QUOTA_EXCEEDED,

    /**
     * Timeout, transport error or 5xx. Repeated failures trigger exponential cooldown.
     */
    TRANSIENT_FAILURE
}
