package com.flagship.invoice_ledger.extraction;

public enum ExtractionStatus {
    SUCCESS,
    FAILED
}
