package com.flagship.invoice_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One line of a voucher. {@code amount} is signed: debit positive, credit negative.
 */
@Value
public class VoucherEntry {
    String ledgerName;
    BigDecimal amount;
    EntryType entryType;

    public static VoucherEntry of(String ledgerName, BigDecimal signedAmount) {
        Objects.requireNonNull(ledgerName, "ledgerName");
        Objects.requireNonNull(signedAmount, "signedAmount");
        return new VoucherEntry(ledgerName, signedAmount, EntryType.forAmount(signedAmount));
    }

    @JsonIgnore
    public boolean isDebit() {
        return entryType == EntryType.DEBIT;
    }
}
