package com.flagship.invoice_ledger.job.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ledger.extraction.ExtractionResult;
import com.flagship.invoice_ledger.extraction.InvoiceFields;
import com.flagship.invoice_ledger.ledger.GstRates;
import lombok.Builder;
import lombok.Value;

/**
 * Per-file entry of the job status response.
 */
@Value
@Builder
public class FileResultResponse {

    @JsonProperty("file_id")
    String fileId;

    @JsonProperty("status")
    String status;

    @JsonProperty("provider_used")
    String providerUsed;

    @JsonProperty("from_cache")
    boolean fromCache;

    @JsonProperty("error")
    String error;

    @JsonProperty("gst_rate")
    Integer gstRate;

    @JsonProperty("fields")
    InvoiceFields fields;

    public static FileResultResponse from(ExtractionResult result) {
        return FileResultResponse.builder()
            .fileId(result.getSourceFileId())
            .status(result.getStatus().name())
            .providerUsed(result.getProviderUsed())
            .fromCache(result.isFromCache())
            .error(result.getErrorDetail())
            .gstRate(result.getFields() != null ? GstRates.rateOf(result.getFields()) : null)
            .fields(result.getFields())
            .build();
    }
}
