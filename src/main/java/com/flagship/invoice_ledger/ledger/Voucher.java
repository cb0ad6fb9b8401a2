package com.flagship.invoice_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * One accounting voucher per usable invoice.
 *
 * Invariant: the signed entry amounts sum to exactly zero.
 */
@Value
public class Voucher {
    LocalDate date;
    String voucherType;
    String number;
    String partyLedger;
    String narration;
    String sourceFileId;
    List<VoucherEntry> entries;

    public Voucher(LocalDate date, String voucherType, String number, String partyLedger,
                   String narration, String sourceFileId, List<VoucherEntry> entries) {
        this.date = date;
        this.voucherType = voucherType;
        this.number = number;
        this.partyLedger = partyLedger;
        this.narration = narration;
        this.sourceFileId = sourceFileId;
        this.entries = List.copyOf(entries);
        if (!isBalanced()) {
            throw new IllegalArgumentException(
                "Voucher " + number + " does not balance: entries sum to " + getEntrySum());
        }
    }

    @JsonIgnore
    public boolean isBalanced() {
        return getEntrySum().signum() == 0;
    }

    @JsonIgnore
    public BigDecimal getEntrySum() {
        return entries.stream()
            .map(VoucherEntry::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
