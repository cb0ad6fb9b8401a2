package com.flagship.invoice_ledger.provider;

import lombok.Getter;

/**
 * A provider call failed in a way that another provider (or a later attempt) may not.
 * Covers timeouts, transport errors, 5xx answers and quota exhaustion.
 */
@Getter
public class TransientProviderException extends RuntimeException {

    private final String providerId;
    private final boolean quotaExceeded;

    public TransientProviderException(String providerId, String message, boolean quotaExceeded) {
        super(message);
        this.providerId = providerId;
        this.quotaExceeded = quotaExceeded;
    }

    public TransientProviderException(String providerId, String message, boolean quotaExceeded, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
        this.quotaExceeded = quotaExceeded;
    }

    public static TransientProviderException quotaExceeded(String providerId, String message) {
        return new TransientProviderException(providerId, message, true);
    }
}
