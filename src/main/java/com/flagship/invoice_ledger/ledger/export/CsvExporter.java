package com.flagship.invoice_ledger.ledger.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.invoice_ledger.extraction.ExtractionResult;
import com.flagship.invoice_ledger.extraction.InvoiceFields;
import com.flagship.invoice_ledger.job.Job;
import com.flagship.invoice_ledger.ledger.GstRates;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Flat per-file export of a job, one row per submitted file in submission order.
 * Failed files keep their row with the error column filled.
 */
@Component
public class CsvExporter {

    private final CsvMapper csvMapper;
    private final CsvSchema schema;

    public CsvExporter() {
        this.csvMapper = new CsvMapper();
        this.csvMapper.configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true);
        this.schema = csvMapper.schemaFor(Row.class).withHeader();
    }

    public String export(Job job) {
        List<Row> rows = new ArrayList<>(job.getFileCount());
        for (ExtractionResult result : job.getResults()) {
            if (result != null) {
                rows.add(toRow(result));
            }
        }
        try {
            return csvMapper.writer(schema).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Job " + job.getJobId() + " could not be exported as CSV", e);
        }
    }

    private static Row toRow(ExtractionResult result) {
        InvoiceFields fields = result.getFields();
        if (fields == null) {
            return new Row(result.getSourceFileId(), result.getStatus().name(),
                null, null, null, null, null, null, null, null, null, null, result.getErrorDetail());
        }
        return new Row(
            result.getSourceFileId(),
            result.getStatus().name(),
            fields.getPartyName(),
            fields.getPartyTaxId(),
            fields.getInvoiceNumber(),
            fields.getInvoiceDate(),
            fields.getTaxableAmount(),
            fields.getCgstAmount(),
            fields.getSgstAmount(),
            fields.getIgstAmount(),
            fields.getTotalAmount(),
            GstRates.rateOf(fields),
            result.getErrorDetail());
    }

    @Value
    @JsonPropertyOrder({"file_id", "status", "party_name", "party_gstin", "invoice_number", "invoice_date",
        "taxable_amount", "cgst_amount", "sgst_amount", "igst_amount", "total_amount", "gst_rate", "error"})
    static class Row {
        @JsonProperty("file_id")
        String fileId;
        @JsonProperty("status")
        String status;
        @JsonProperty("party_name")
        String partyName;
        @JsonProperty("party_gstin")
        String partyGstin;
        @JsonProperty("invoice_number")
        String invoiceNumber;
        @JsonProperty("invoice_date")
        String invoiceDate;
        @JsonProperty("taxable_amount")
        BigDecimal taxableAmount;
        @JsonProperty("cgst_amount")
        BigDecimal cgstAmount;
        @JsonProperty("sgst_amount")
        BigDecimal sgstAmount;
        @JsonProperty("igst_amount")
        BigDecimal igstAmount;
        @JsonProperty("total_amount")
        BigDecimal totalAmount;
        @JsonProperty("gst_rate")
        Integer gstRate;
        @JsonProperty("error")
        String error;
    }
}
