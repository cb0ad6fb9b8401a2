package com.flagship.invoice_ledger.ledger;

import com.flagship.invoice_ledger.job.TransactionType;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Accounting view of a completed job: account groups, ledger masters and vouchers,
 * ready for export.
 *
 * Every ledger named by a voucher entry is present in {@code ledgers}, and every
 * ledger parent is present in {@code groups}.
 */
@Value
public class LedgerDocument {
    String companyName;
    TransactionType transactionType;
    /** Group name to parent group name; an empty parent is a primary group. */
    Map<String, String> groups;
    List<LedgerMaster> ledgers;
    List<Voucher> vouchers;
    LedgerSummary summary;

    public LedgerDocument(String companyName, TransactionType transactionType, Map<String, String> groups,
                          List<LedgerMaster> ledgers, List<Voucher> vouchers, LedgerSummary summary) {
        this.companyName = companyName;
        this.transactionType = transactionType;
        this.groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
        this.ledgers = List.copyOf(ledgers);
        this.vouchers = List.copyOf(vouchers);
        this.summary = summary;
    }

    public Optional<LedgerMaster> ledger(String name) {
        return ledgers.stream().filter(ledger -> ledger.getName().equals(name)).findFirst();
    }
}
