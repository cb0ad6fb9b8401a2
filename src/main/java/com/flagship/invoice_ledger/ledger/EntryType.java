package com.flagship.invoice_ledger.ledger;

import java.math.BigDecimal;

/**
 * Side of a voucher entry in double-entry accounting.
 * Debits carry positive signed amounts, credits negative ones.
 */
public enum EntryType {
    DEBIT,
    CREDIT;

    public static EntryType forAmount(BigDecimal signedAmount) {
        return signedAmount.signum() >= 0 ? DEBIT : CREDIT;
    }
}
