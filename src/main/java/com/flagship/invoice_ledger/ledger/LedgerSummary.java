package com.flagship.invoice_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class LedgerSummary {
    @JsonProperty("successful_count")
    int successfulCount;

    @JsonProperty("failed_count")
    int failedCount;

    @JsonProperty("voucher_count")
    int voucherCount;

    List<FileFailure> failures;

    /** Successful files whose rate came out as zero or undeterminable. */
    @JsonProperty("no_tax_detected")
    List<String> noTaxDetected;

    /** Successful files with neither total nor taxable amount. */
    List<String> skipped;

    @JsonProperty("gst_rates")
    List<Integer> gstRates;

    /**
     * A file that produced no voucher because extraction failed.
     */
    @Value
    public static class FileFailure {
        @JsonProperty("file_id")
        String fileId;
        String reason;
    }
}
