package com.flagship.invoice_ledger.extraction;

/**
 * Fixed instructions sent with invoice images.
 */
public final class ExtractionPrompts {

    private static final String FIELD_LIST =
        "\"party_name\", \"party_gstin\", \"invoice_number\", \"invoice_date\", \"taxable_value\", "
            + "\"cgst\", \"sgst\", \"igst\", \"invoice_value\", \"currency\" and \"line_items\" "
            + "(an array of objects with \"description\", \"quantity\", \"unit_price\", \"amount\")";

    private static final String RULES =
        " Amounts must be plain numbers without currency symbols or thousands separators."
            + " Use null for any field that is not printed on the document; use 0 only when the document shows zero.";

    private ExtractionPrompts() {
    }

    public static String singleInvoice() {
        return "Extract the PARTY NAME, PARTY GSTIN, TAX INVOICE NO., INVOICE DATE, TAXABLE VALUE, CGST, SGST, IGST,"
            + " INVOICE VALUE from this document. Respond with one JSON object with the keys " + FIELD_LIST + "."
            + RULES;
    }

    public static String batch(int imageCount) {
        return "You are given " + imageCount + " invoice documents, in order. For each document extract the"
            + " PARTY NAME, PARTY GSTIN, TAX INVOICE NO., INVOICE DATE, TAXABLE VALUE, CGST, SGST, IGST, INVOICE VALUE."
            + " Respond with a JSON array of exactly " + imageCount + " objects, one per document in the order given,"
            + " each with the keys " + FIELD_LIST + "." + RULES;
    }
}
