package com.flagship.invoice_ledger.job.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ledger.ledger.LedgerDocument;
import com.flagship.invoice_ledger.ledger.LedgerMaster;
import com.flagship.invoice_ledger.ledger.LedgerSummary;
import com.flagship.invoice_ledger.ledger.Voucher;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class LedgerResponse {

    @JsonProperty("job_id")
    UUID jobId;

    @JsonProperty("company_name")
    String companyName;

    @JsonProperty("transaction_type")
    String transactionType;

    @JsonProperty("summary")
    LedgerSummary summary;

    @JsonProperty("groups")
    Map<String, String> groups;

    @JsonProperty("ledgers")
    List<LedgerMaster> ledgers;

    @JsonProperty("vouchers")
    List<Voucher> vouchers;

    public static LedgerResponse from(UUID jobId, LedgerDocument document) {
        return LedgerResponse.builder()
            .jobId(jobId)
            .companyName(document.getCompanyName())
            .transactionType(document.getTransactionType().getDisplayName())
            .summary(document.getSummary())
            .groups(document.getGroups())
            .ledgers(document.getLedgers())
            .vouchers(document.getVouchers())
            .build();
    }
}
