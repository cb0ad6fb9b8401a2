package com.flagship.invoice_ledger.job;

import java.util.Locale;

/**
 * Direction of the invoices in a job, which decides ledger groups and entry signs.
 */
public enum TransactionType {
    SALES("Sales", "Sundry Debtors", "Sales Account", "Sales Accounts"),
    PURCHASE("Purchase", "Sundry Creditors", "Purchase Account", "Purchase Accounts");

    private final String displayName;
    private final String partyGroup;
    private final String principalLedger;
    private final String principalGroup;

    TransactionType(String displayName, String partyGroup, String principalLedger, String principalGroup) {
        this.displayName = displayName;
        this.partyGroup = partyGroup;
        this.principalLedger = principalLedger;
        this.principalGroup = principalGroup;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getPartyGroup() {
        return partyGroup;
    }

    public String getPrincipalLedger() {
        return principalLedger;
    }

    public String getPrincipalGroup() {
        return principalGroup;
    }

    /**
     * Accepts "Sales", "PURCHASE" and labels such as "Sales - GST 18%".
     *
     * @throws IllegalArgumentException for anything else
     */
    public static TransactionType parse(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (TransactionType type : values()) {
                if (normalized.equals(type.name()) || normalized.startsWith(type.name() + " ")) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Invalid transaction type: " + value + ". Expected Sales or Purchase");
    }
}
