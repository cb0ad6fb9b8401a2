package com.flagship.invoice_ledger.extraction;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;

/**
 * Structured fields extracted from one invoice.
 *
 * Amounts are scale-2 decimals. A null field means the provider did not report it;
 * zero is only present when the provider stated zero.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class InvoiceFields {
    String partyName;
    String partyTaxId;
    String invoiceNumber;
    /** Raw date text as printed on the invoice. */
    String invoiceDate;
    BigDecimal taxableAmount;
    BigDecimal cgstAmount;
    BigDecimal sgstAmount;
    BigDecimal igstAmount;
    BigDecimal totalAmount;
    String currency;
    @Singular
    List<LineItem> lineItems;
}
