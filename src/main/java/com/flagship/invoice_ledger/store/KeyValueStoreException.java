package com.flagship.invoice_ledger.store;

/**
 * Raised when the backing store cannot serve a request.
 */
public class KeyValueStoreException extends RuntimeException {

    public KeyValueStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
