package com.flagship.invoice_ledger.extraction;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

/**
 * Outcome of extracting one file. Immutable; exactly one per file per job.
 */
@Value
public class ExtractionResult {
    String sourceFileId;
    InvoiceFields fields;
    ExtractionStatus status;
    String errorDetail;
    String providerUsed;
    boolean fromCache;

    public static ExtractionResult success(String sourceFileId, InvoiceFields fields, String providerUsed) {
        return new ExtractionResult(sourceFileId, fields, ExtractionStatus.SUCCESS, null, providerUsed, false);
    }

    public static ExtractionResult cached(String sourceFileId, InvoiceFields fields, String providerUsed) {
        return new ExtractionResult(sourceFileId, fields, ExtractionStatus.SUCCESS, null, providerUsed, true);
    }

    public static ExtractionResult failed(String sourceFileId, String errorDetail, String providerUsed) {
        return new ExtractionResult(sourceFileId, null, ExtractionStatus.FAILED, errorDetail, providerUsed, false);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == ExtractionStatus.SUCCESS;
    }
}
