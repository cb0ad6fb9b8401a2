package com.flagship.invoice_ledger.job.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ledger.job.Job;
import com.flagship.invoice_ledger.job.JobStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Polling view of a job. {@code results} lists processed files only, in submission order.
 */
@Value
@Builder
public class JobStatusResponse {

    @JsonProperty("job_id")
    UUID jobId;

    @JsonProperty("status")
    JobStatus status;

    @JsonProperty("company_name")
    String companyName;

    @JsonProperty("transaction_type")
    String transactionType;

    @JsonProperty("total_files")
    int totalFiles;

    @JsonProperty("processed_files")
    int processedFiles;

    @JsonProperty("successful_files")
    int successfulFiles;

    @JsonProperty("failed_files")
    int failedFiles;

    @JsonProperty("progress_percentage")
    BigDecimal progressPercentage;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("results")
    List<FileResultResponse> results;

    public static JobStatusResponse from(Job job) {
        return JobStatusResponse.builder()
            .jobId(job.getJobId())
            .status(job.getStatus())
            .companyName(job.getCompanyName())
            .transactionType(job.getTransactionType().getDisplayName())
            .totalFiles(job.getFileCount())
            .processedFiles(job.getProcessedCount())
            .successfulFiles(job.getSuccessfulCount())
            .failedFiles(job.getFailedCount())
            .progressPercentage(BigDecimal.valueOf(job.getProcessedCount() * 100L)
                .divide(BigDecimal.valueOf(job.getFileCount()), 1, RoundingMode.HALF_UP))
            .failureReason(job.getFailureReason())
            .createdAt(job.getCreatedAt())
            .updatedAt(job.getUpdatedAt())
            .results(job.getResults().stream()
                .filter(Objects::nonNull)
                .map(FileResultResponse::from)
                .toList())
            .build();
    }
}
