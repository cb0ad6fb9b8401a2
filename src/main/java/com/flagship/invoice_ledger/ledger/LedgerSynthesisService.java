package com.flagship.invoice_ledger.ledger;

import com.flagship.invoice_ledger.extraction.ExtractionResult;
import com.flagship.invoice_ledger.extraction.InvoiceFields;
import com.flagship.invoice_ledger.job.Job;
import com.flagship.invoice_ledger.job.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Builds double-entry vouchers and ledger masters from the results of a completed job.
 *
 * Enforces:
 * 1. Only successful extractions become vouchers; failures are listed in the summary
 * 2. Every voucher balances to exactly zero (debit positive, credit negative)
 * 3. One tax ledger per GST rate that actually carries an entry
 * 4. One party ledger per distinct party name
 * 5. Vouchers keep the original file order
 *
 * Sales invoices debit the party with the invoice total and credit the sales
 * account and tax ledgers. Purchase invoices mirror the signs. Whatever the taxable
 * amount and taxes do not explain is absorbed by the principal entry.
 */
@Service
@Slf4j
public class LedgerSynthesisService {

    public static final String DUTIES_AND_TAXES = "Duties & Taxes";
    public static final String UNKNOWN_PARTY = "Unknown Party";
    public static final String PARTY_SUFFIX = " (Party)";

    private static final Pattern TAX_LEDGER_NAME =
        Pattern.compile("(?i)(sales|purchase) - GST \\d+%");

    // parents outside the document are Tally's built-in primary groups
    private static final String CURRENT_ASSETS = "Current Assets";
    private static final String CURRENT_LIABILITIES = "Current Liabilities";
    private static final String PRIMARY = "";

    private static final List<DateTimeFormatter> DATE_FORMATS = Stream.of(
            "d/M/uuuu", "d-M-uuuu", "d.M.uuuu",
            "uuuu-M-d", "uuuu/M/d",
            "d-MMM-uuuu", "d MMM uuuu", "d MMMM uuuu", "d-MMMM-uuuu",
            "MMM d, uuuu", "MMMM d, uuuu",
            "d/M/uu", "d-M-uu", "d.M.uu", "d-MMM-uu", "d MMM uu")
        .map(pattern -> new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT))
        .toList();

    /**
     * Synthesizes the ledger document for a job. The caller is responsible for
     * checking that the job is COMPLETED.
     */
    public LedgerDocument synthesize(Job job) {
        TransactionType type = job.getTransactionType();
        LocalDate fallbackDate = LocalDate.ofInstant(job.getCreatedAt(), ZoneOffset.UTC);

        Map<String, LedgerMaster> parties = new LinkedHashMap<>();
        Map<Integer, LedgerMaster> taxLedgers = new LinkedHashMap<>();
        List<Voucher> vouchers = new ArrayList<>();
        List<LedgerSummary.FileFailure> failures = new ArrayList<>();
        List<String> noTaxDetected = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        int successful = 0;

        for (ExtractionResult result : job.getResults()) {
            if (result == null) {
                continue;
            }
            if (!result.isSuccess()) {
                failures.add(new LedgerSummary.FileFailure(result.getSourceFileId(), result.getErrorDetail()));
                continue;
            }
            successful++;

            InvoiceFields fields = result.getFields();
            String fileId = result.getSourceFileId();
            if (fields.getTotalAmount() == null && fields.getTaxableAmount() == null) {
                log.info("File {} has neither total nor taxable amount, no voucher created", fileId);
                skipped.add(fileId);
                continue;
            }

            int rate = GstRates.rateOf(fields);
            List<BigDecimal> taxComponents = rate > 0 ? taxComponents(fields) : List.of();
            if (taxComponents.isEmpty()) {
                noTaxDetected.add(fileId);
            }
            BigDecimal taxTotal = taxComponents.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal invoiceTotal = fields.getTotalAmount() != null
                ? fields.getTotalAmount()
                : fields.getTaxableAmount().add(taxTotal);
            if (invoiceTotal.signum() == 0) {
                log.info("File {} has a zero invoice total, no voucher created", fileId);
                skipped.add(fileId);
                continue;
            }

            String partyName = partyName(fields);
            LedgerMaster existing = parties.get(partyName);
            if (existing == null || (existing.getPartyTaxId() == null && fields.getPartyTaxId() != null)) {
                parties.put(partyName, LedgerMaster.party(partyName, type.getPartyGroup(), fields.getPartyTaxId()));
            }

            BigDecimal sign = type == TransactionType.SALES ? BigDecimal.ONE : BigDecimal.ONE.negate();
            BigDecimal principal = invoiceTotal.subtract(taxTotal);
            if (fields.getTaxableAmount() != null && principal.compareTo(fields.getTaxableAmount()) != 0) {
                log.debug("File {}: difference of {} absorbed into {}",
                    fileId, principal.subtract(fields.getTaxableAmount()), type.getPrincipalLedger());
            }

            List<VoucherEntry> entries = new ArrayList<>();
            entries.add(VoucherEntry.of(partyName, invoiceTotal.multiply(sign)));
            entries.add(VoucherEntry.of(type.getPrincipalLedger(), principal.multiply(sign).negate()));
            if (!taxComponents.isEmpty()) {
                String taxLedger = taxLedgerName(type, rate);
                taxLedgers.putIfAbsent(rate, LedgerMaster.tax(taxLedger, rate));
                for (BigDecimal component : taxComponents) {
                    entries.add(VoucherEntry.of(taxLedger, component.multiply(sign).negate()));
                }
            }

            String number = fields.getInvoiceNumber() != null ? fields.getInvoiceNumber() : fileId;
            vouchers.add(new Voucher(
                voucherDate(fields.getInvoiceDate(), fallbackDate),
                type.getDisplayName(),
                number,
                partyName,
                String.format("%s invoice %s from %s", type.getDisplayName(), number, partyName),
                fileId,
                entries
            ));
        }

        Map<String, String> groups = new LinkedHashMap<>();
        List<LedgerMaster> ledgers = new ArrayList<>();
        if (!vouchers.isEmpty()) {
            groups.put(type.getPartyGroup(), type == TransactionType.SALES ? CURRENT_ASSETS : CURRENT_LIABILITIES);
            groups.put(type.getPrincipalGroup(), PRIMARY);
            ledgers.addAll(parties.values());
            ledgers.add(LedgerMaster.principal(type.getPrincipalLedger(), type.getPrincipalGroup()));
        }
        if (!taxLedgers.isEmpty()) {
            groups.put(DUTIES_AND_TAXES, CURRENT_LIABILITIES);
            ledgers.addAll(taxLedgers.values());
        }

        LedgerSummary summary = LedgerSummary.builder()
            .successfulCount(successful)
            .failedCount(failures.size())
            .voucherCount(vouchers.size())
            .failures(failures)
            .noTaxDetected(noTaxDetected)
            .skipped(skipped)
            .gstRates(new ArrayList<>(taxLedgers.keySet()))
            .build();

        log.info("Synthesized ledger for job {}: vouchers={}, failures={}, skipped={}, rates={}",
            job.getJobId(), vouchers.size(), failures.size(), skipped.size(), taxLedgers.keySet());

        return new LedgerDocument(job.getCompanyName(), type, groups, ledgers, vouchers, summary);
    }

    public static String taxLedgerName(TransactionType type, int rate) {
        return type.getDisplayName() + " - GST " + rate + "%";
    }

    /**
     * Parses the raw invoice date, falling back when it is missing or in no known format.
     */
    static LocalDate voucherDate(String rawDate, LocalDate fallback) {
        if (rawDate == null || rawDate.isBlank()) {
            return fallback;
        }
        String trimmed = rawDate.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(trimmed, format);
            } catch (DateTimeParseException e) {
                log.trace("Date '{}' does not match {}", trimmed, format);
            }
        }
        log.debug("Unrecognized invoice date '{}', using {}", rawDate, fallback);
        return fallback;
    }

    private static List<BigDecimal> taxComponents(InvoiceFields fields) {
        List<BigDecimal> components = new ArrayList<>();
        if (GstRates.usesSplitTax(fields)) {
            addIfNonZero(components, fields.getCgstAmount());
            addIfNonZero(components, fields.getSgstAmount());
        } else if (GstRates.usesIntegratedTax(fields)) {
            addIfNonZero(components, fields.getIgstAmount());
        }
        return components;
    }

    private static void addIfNonZero(List<BigDecimal> components, BigDecimal amount) {
        if (amount != null && amount.signum() != 0) {
            components.add(amount);
        }
    }

    /**
     * Party ledger name for an invoice. A name that would clash with a ledger or group this
     * service creates itself gets the {@link #PARTY_SUFFIX}, since Tally master names are unique.
     */
    static String partyName(InvoiceFields fields) {
        String name = fields.getPartyName();
        if (name == null || name.isBlank()) {
            return UNKNOWN_PARTY;
        }
        String trimmed = name.trim();
        return isReservedName(trimmed) ? trimmed + PARTY_SUFFIX : trimmed;
    }

    private static boolean isReservedName(String name) {
        if (TAX_LEDGER_NAME.matcher(name).matches()) {
            return true;
        }
        for (String group : List.of(DUTIES_AND_TAXES, CURRENT_ASSETS, CURRENT_LIABILITIES)) {
            if (name.equalsIgnoreCase(group)) {
                return true;
            }
        }
        for (TransactionType type : TransactionType.values()) {
            if (name.equalsIgnoreCase(type.getPrincipalLedger())
                    || name.equalsIgnoreCase(type.getPrincipalGroup())
                    || name.equalsIgnoreCase(type.getPartyGroup())) {
                return true;
            }
        }
        return false;
    }
}
