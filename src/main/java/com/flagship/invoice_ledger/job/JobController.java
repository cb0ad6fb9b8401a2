package com.flagship.invoice_ledger.job;

import com.flagship.invoice_ledger.extraction.SourceFile;
import com.flagship.invoice_ledger.job.dto.CreateJobResponse;
import com.flagship.invoice_ledger.job.dto.JobStatusResponse;
import com.flagship.invoice_ledger.job.dto.LedgerResponse;
import com.flagship.invoice_ledger.ledger.LedgerDocument;
import com.flagship.invoice_ledger.ledger.export.CsvExporter;
import com.flagship.invoice_ledger.ledger.export.TallyXmlWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * REST controller for extraction jobs.
 *
 * Job creation returns 202 immediately; clients poll {@code GET /api/jobs/{id}}
 * and fetch the ledger or exports once the job is COMPLETED.
 */
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
@Slf4j
public class JobController {

    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final JobService jobService;
    private final TallyXmlWriter tallyXmlWriter;
    private final CsvExporter csvExporter;

    /**
     * Accepts invoice documents and starts an extraction job.
     *
     * @param files invoice images or PDFs, in the order results should keep
     * @param companyName company the ledger is generated for
     * @param transactionType "Sales" or "Purchase"
     * @param bypassCache skip the content cache for this job
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CreateJobResponse> createJob(
            @RequestParam("files") List<MultipartFile> files,
            @RequestParam("company_name") String companyName,
            @RequestParam("transaction_type") String transactionType,
            @RequestParam(value = "bypass_cache", defaultValue = "false") boolean bypassCache) throws IOException {

        TransactionType type = TransactionType.parse(transactionType);
        log.info("Received job request: files={}, company={}, type={}, bypassCache={}",
                files.size(), companyName, type, bypassCache);

        List<SourceFile> sourceFiles = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            MultipartFile file = files.get(i);
            String fileId = file.getOriginalFilename() != null && !file.getOriginalFilename().isBlank()
                    ? file.getOriginalFilename()
                    : "file-" + (i + 1);
            sourceFiles.add(new SourceFile(fileId, file.getBytes(), file.getContentType()));
        }

        UUID jobId = jobService.createJob(sourceFiles, companyName, type, bypassCache);

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(CreateJobResponse.builder()
                        .jobId(jobId)
                        .totalFiles(sourceFiles.size())
                        .status(JobStatus.PENDING)
                        .message("Job accepted; poll /api/jobs/" + jobId + " for progress")
                        .build());
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<JobStatusResponse> getJob(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(JobStatusResponse.from(jobService.getJobStatus(id)));
    }

    @GetMapping(value = "/{id}/ledger", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<LedgerResponse> getLedger(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(LedgerResponse.from(id, jobService.getLedgerDocument(id)));
    }

    /**
     * Tally import file for the job's ledger.
     */
    @GetMapping("/{id}/ledger.xml")
    public ResponseEntity<byte[]> getLedgerXml(@PathVariable("id") UUID id) {
        LedgerDocument document = jobService.getLedgerDocument(id);
        return attachment(tallyXmlWriter.write(document), MediaType.APPLICATION_XML, "tally_import_" + id + ".xml");
    }

    /**
     * Per-file CSV of the extracted fields, failed files included.
     */
    @GetMapping("/{id}/export.csv")
    public ResponseEntity<byte[]> exportCsv(@PathVariable("id") UUID id) {
        Job job = jobService.getCompletedJob(id);
        byte[] csv = csvExporter.export(job).getBytes(StandardCharsets.UTF_8);
        return attachment(csv, TEXT_CSV, "invoices_" + id + ".csv");
    }

    private static ResponseEntity<byte[]> attachment(byte[] body, MediaType mediaType, String filename) {
        return ResponseEntity.ok()
                .contentType(mediaType)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(filename).build().toString())
                .body(body);
    }
}
