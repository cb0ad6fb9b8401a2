package com.flagship.invoice_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

/**
 * Ledger account definition. {@code gstRate} is set on tax ledgers, {@code partyTaxId} on party ledgers.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LedgerMaster {
    String name;
    String parent;
    Integer gstRate;
    String partyTaxId;

    public static LedgerMaster party(String name, String parent, String partyTaxId) {
        return new LedgerMaster(name, parent, null, partyTaxId);
    }

    public static LedgerMaster principal(String name, String parent) {
        return new LedgerMaster(name, parent, null, null);
    }

    public static LedgerMaster tax(String name, int gstRate) {
        return new LedgerMaster(name, LedgerSynthesisService.DUTIES_AND_TAXES, gstRate, null);
    }
}
