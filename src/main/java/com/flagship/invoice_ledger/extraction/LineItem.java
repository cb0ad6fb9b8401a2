package com.flagship.invoice_ledger.extraction;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One row of an invoice's item table. Null numeric values are unknown.
 */
@Value
public class LineItem {
    String description;
    BigDecimal quantity;
    BigDecimal unitPrice;
    BigDecimal amount;
}
