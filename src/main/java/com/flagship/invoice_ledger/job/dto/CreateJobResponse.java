package com.flagship.invoice_ledger.job.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.invoice_ledger.job.JobStatus;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class CreateJobResponse {

    @JsonProperty("job_id")
    UUID jobId;

    @JsonProperty("total_files")
    int totalFiles;

    @JsonProperty("status")
    JobStatus status;

    @JsonProperty("message")
    String message;
}
