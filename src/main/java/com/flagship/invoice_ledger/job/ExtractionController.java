package com.flagship.invoice_ledger.job;

import com.flagship.invoice_ledger.extraction.ContentFingerprint;
import com.flagship.invoice_ledger.extraction.ExtractionClient;
import com.flagship.invoice_ledger.extraction.ExtractionResult;
import com.flagship.invoice_ledger.extraction.SourceFile;
import com.flagship.invoice_ledger.job.dto.FileResultResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Synchronous extraction of a single document, without a job or a ledger.
 * The request blocks until the provider answers or every attempt is spent.
 */
@RestController
@RequestMapping("/api/extract")
@RequiredArgsConstructor
@Slf4j
public class ExtractionController {

    private final ExtractionClient extractionClient;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<FileResultResponse> extract(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "bypass_cache", defaultValue = "false") boolean bypassCache) throws IOException {

        String fileId = file.getOriginalFilename() != null && !file.getOriginalFilename().isBlank()
                ? file.getOriginalFilename()
                : "file-1";
        if (file.isEmpty()) {
            throw new IllegalArgumentException("File " + fileId + " is empty");
        }
        if (file.getContentType() == null || !JobService.ALLOWED_MIME_TYPES.contains(file.getContentType())) {
            throw new IllegalArgumentException("Unsupported file type " + file.getContentType()
                    + ". Allowed types: image/jpeg, image/png, image/webp, application/pdf");
        }

        byte[] data = file.getBytes();
        log.info("Received extraction request: file={}, type={}, bytes={}, bypassCache={}",
                fileId, file.getContentType(), data.length, bypassCache);

        ExtractionResult result = extractionClient.extract(
                new SourceFile(fileId, data, file.getContentType()), ContentFingerprint.of(data), bypassCache);

        log.info("Extraction of {} finished: status={}, provider={}",
                fileId, result.getStatus(), result.getProviderUsed());
        return ResponseEntity.ok(FileResultResponse.from(result));
    }
}
