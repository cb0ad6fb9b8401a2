package com.flagship.invoice_ledger.ledger;

import com.flagship.invoice_ledger.extraction.InvoiceFields;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Derives the GST rate of an invoice from its extracted amounts.
 */
@Slf4j
public final class GstRates {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /** Highest rate accepted as plausible; anything above is treated as a misread amount. */
    static final int MAX_RATE = 100;

    private GstRates() {
    }

    /**
     * Whole-percent rate: (cgst + sgst) / taxable when the split halves carry tax, otherwise
     * igst / taxable. Returns 0 when taxable is not positive, no component carries tax, or the
     * result is not a plausible rate.
     */
    public static int rateOf(InvoiceFields fields) {
        if (usesSplitTax(fields)) {
            return percent(fields.getCgstAmount().add(fields.getSgstAmount()), fields.getTaxableAmount());
        }
        if (usesIntegratedTax(fields)) {
            return percent(fields.getIgstAmount(), fields.getTaxableAmount());
        }
        return 0;
    }

    /**
     * CGST and SGST are both known and together non-zero. Invoices printing
     * "CGST 0.00 / SGST 0.00" next to an IGST amount are integrated-tax invoices.
     */
    static boolean usesSplitTax(InvoiceFields fields) {
        return hasPositiveTaxable(fields)
            && fields.getCgstAmount() != null
            && fields.getSgstAmount() != null
            && fields.getCgstAmount().add(fields.getSgstAmount()).signum() != 0;
    }

    static boolean usesIntegratedTax(InvoiceFields fields) {
        return hasPositiveTaxable(fields)
            && !usesSplitTax(fields)
            && fields.getIgstAmount() != null
            && fields.getIgstAmount().signum() != 0;
    }

    private static boolean hasPositiveTaxable(InvoiceFields fields) {
        return fields.getTaxableAmount() != null && fields.getTaxableAmount().signum() > 0;
    }

    private static int percent(BigDecimal tax, BigDecimal taxable) {
        BigDecimal rate = tax.multiply(HUNDRED).divide(taxable, 0, RoundingMode.HALF_UP);
        if (rate.signum() < 0 || rate.compareTo(BigDecimal.valueOf(MAX_RATE)) > 0) {
            log.debug("Implausible GST rate {}% from tax {} on taxable {}, ignored", rate, tax, taxable);
            return 0;
        }
        return rate.intValue();
    }
}
