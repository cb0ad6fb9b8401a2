package com.flagship.invoice_ledger.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns free-form provider text into {@link InvoiceFields}.
 *
 * Providers wrap their JSON in prose or markdown fences, so the parser cuts the text
 * between the outermost brackets before decoding. Every failure is reported as a
 * {@link ParsedResponse} failure; nothing is thrown.
 */
@Slf4j
public class ProviderResponseParser {

    public static final String UNPARSEABLE = "unparseable provider response";

    private static final Map<String, List<String>> ALIASES = Map.ofEntries(
        Map.entry("partyName", List.of("party_name", "party", "vendor_name", "supplier_name", "seller_name",
            "customer_name", "buyer_name")),
        Map.entry("partyTaxId", List.of("party_tax_id", "party_gstin", "gstin", "party_gst_no", "gst_no",
            "gst_number", "tax_id")),
        Map.entry("invoiceNumber", List.of("invoice_number", "invoice_no", "tax_invoice_no", "tax_invoice_number",
            "invoice_num", "bill_no", "bill_number")),
        Map.entry("invoiceDate", List.of("invoice_date", "date", "bill_date", "date_of_invoice")),
        Map.entry("taxableAmount", List.of("taxable_amount", "taxable_value", "taxable", "sub_total", "subtotal",
            "net_amount")),
        Map.entry("cgstAmount", List.of("cgst_amount", "cgst")),
        Map.entry("sgstAmount", List.of("sgst_amount", "sgst", "sgst_utgst", "utgst")),
        Map.entry("igstAmount", List.of("igst_amount", "igst")),
        Map.entry("totalAmount", List.of("total_amount", "invoice_value", "total_invoice_value", "invoice_total",
            "grand_total", "total", "amount")),
        Map.entry("currency", List.of("currency", "currency_code")),
        Map.entry("lineItems", List.of("line_items", "items", "line_item"))
    );

    private static final Set<String> BATCH_WRAPPERS = Set.of("invoices", "results", "data", "documents");

    private static final Pattern AMOUNT = Pattern.compile("-?\\d[\\d,]*(?:\\.\\d+)?");

    private static final Set<String> NULL_MARKERS = Set.of("", "null", "none", "n/a", "na", "-", "nil", "not available");

    private final ObjectMapper objectMapper;

    public ProviderResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a response expected to contain one JSON object.
     */
    public ParsedResponse parseSingle(String text) {
        if (text == null) {
            return ParsedResponse.failure(UNPARSEABLE);
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end < start) {
            return ParsedResponse.failure(UNPARSEABLE);
        }
        JsonNode node = readTree(text.substring(start, end + 1));
        if (node == null || !node.isObject()) {
            return ParsedResponse.failure(UNPARSEABLE);
        }
        return ParsedResponse.success(toFields(node));
    }

    /**
     * Parses a batch response into exactly {@code imageCount} entries, position i belonging to image i.
     *
     * Extra entries are dropped. Missing trailing entries fail with a count mismatch, since
     * the pairing of entries to images cannot be trusted past the returned count.
     */
    public List<ParsedResponse> parseBatch(String text, int imageCount) {
        List<JsonNode> entries = batchEntries(text);
        List<ParsedResponse> parsed = new ArrayList<>(imageCount);
        if (entries == null) {
            for (int i = 0; i < imageCount; i++) {
                parsed.add(ParsedResponse.failure(UNPARSEABLE));
            }
            return parsed;
        }
        if (entries.size() > imageCount) {
            log.warn("Provider returned {} entries for {} images, extra entries ignored", entries.size(), imageCount);
        }
        for (int i = 0; i < imageCount; i++) {
            if (i >= entries.size()) {
                parsed.add(ParsedResponse.failure(
                    "provider returned " + entries.size() + " entries for " + imageCount + " images"));
            } else if (entries.get(i).isObject()) {
                parsed.add(ParsedResponse.success(toFields(entries.get(i))));
            } else {
                parsed.add(ParsedResponse.failure(UNPARSEABLE));
            }
        }
        return parsed;
    }

    private List<JsonNode> batchEntries(String text) {
        if (text == null) {
            return null;
        }
        int arrayStart = text.indexOf('[');
        int objectStart = text.indexOf('{');
        boolean objectFirst = objectStart >= 0 && (arrayStart < 0 || objectStart < arrayStart);

        if (!objectFirst && arrayStart >= 0) {
            int arrayEnd = text.lastIndexOf(']');
            if (arrayEnd > arrayStart) {
                JsonNode array = readTree(text.substring(arrayStart, arrayEnd + 1));
                if (array != null && array.isArray()) {
                    return toList(array);
                }
            }
        }

        int objectEnd = text.lastIndexOf('}');
        if (objectStart < 0 || objectEnd < objectStart) {
            return null;
        }
        JsonNode object = readTree(text.substring(objectStart, objectEnd + 1));
        if (object == null || !object.isObject()) {
            return null;
        }
        for (String wrapper : BATCH_WRAPPERS) {
            JsonNode wrapped = object.get(wrapper);
            if (wrapped != null && wrapped.isArray()) {
                return toList(wrapped);
            }
        }
        return List.of(object);
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.debug("Provider response is not valid JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static List<JsonNode> toList(JsonNode array) {
        List<JsonNode> nodes = new ArrayList<>(array.size());
        array.forEach(nodes::add);
        return nodes;
    }

    InvoiceFields toFields(JsonNode object) {
        Map<String, JsonNode> normalized = normalizeKeys(object);
        InvoiceFields.InvoiceFieldsBuilder builder = InvoiceFields.builder()
            .partyName(text(lookup(normalized, "partyName")))
            .partyTaxId(text(lookup(normalized, "partyTaxId")))
            .invoiceNumber(text(lookup(normalized, "invoiceNumber")))
            .invoiceDate(text(lookup(normalized, "invoiceDate")))
            .taxableAmount(decimal(lookup(normalized, "taxableAmount")))
            .cgstAmount(decimal(lookup(normalized, "cgstAmount")))
            .sgstAmount(decimal(lookup(normalized, "sgstAmount")))
            .igstAmount(decimal(lookup(normalized, "igstAmount")))
            .totalAmount(decimal(lookup(normalized, "totalAmount")))
            .currency(text(lookup(normalized, "currency")));

        JsonNode items = lookup(normalized, "lineItems");
        if (items != null && items.isArray()) {
            for (JsonNode item : items) {
                if (item.isObject()) {
                    Map<String, JsonNode> itemFields = normalizeKeys(item);
                    builder.lineItem(new LineItem(
                        text(firstOf(itemFields, "description", "item", "name", "particulars")),
                        decimal(firstOf(itemFields, "quantity", "qty")),
                        decimal(firstOf(itemFields, "unit_price", "rate", "price")),
                        decimal(firstOf(itemFields, "amount", "value", "total"))
                    ));
                }
            }
        }
        return builder.build();
    }

    private static Map<String, JsonNode> normalizeKeys(JsonNode object) {
        Map<String, JsonNode> normalized = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            normalized.putIfAbsent(normalizeKey(field.getKey()), field.getValue());
        }
        return normalized;
    }

    /**
     * "TAX INVOICE NO." becomes "tax_invoice_no", "partyGstin" becomes "party_gstin".
     */
    static String normalizeKey(String key) {
        String snake = key.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        return snake.toLowerCase()
            .replaceAll("[^a-z0-9]+", "_")
            .replaceAll("^_+|_+$", "");
    }

    private static JsonNode lookup(Map<String, JsonNode> normalized, String field) {
        for (String alias : ALIASES.get(field)) {
            JsonNode value = normalized.get(alias);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static JsonNode firstOf(Map<String, JsonNode> normalized, String... keys) {
        for (String key : keys) {
            JsonNode value = normalized.get(key);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText().trim();
        return NULL_MARKERS.contains(value.toLowerCase()) ? null : value;
    }

    /**
     * Coerces a JSON value into a scale-2 amount. Non-numeric values become unknown (null).
     */
    static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isObject()) {
            // some models answer {"rate": "9%", "amount": 90}
            JsonNode inner = node.has("amount") ? node.get("amount") : node.get("value");
            return inner == null || inner.isObject() ? null : decimal(inner);
        }
        if (node.isNumber()) {
            return node.decimalValue().setScale(2, RoundingMode.HALF_UP);
        }
        if (!node.isTextual()) {
            return null;
        }
        // "Rs.1,180.00", "INR 1180", "₹ 1,180": the first number in the text is the amount
        Matcher number = AMOUNT.matcher(node.asText());
        if (!number.find()) {
            return null;
        }
        try {
            return new BigDecimal(number.group().replace(",", "")).setScale(2, RoundingMode.HALF_UP);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Tagged outcome of parsing one entry.
     */
    @Value
    public static class ParsedResponse {
        InvoiceFields fields;
        String error;

        public static ParsedResponse success(InvoiceFields fields) {
            return new ParsedResponse(fields, null);
        }

        public static ParsedResponse failure(String error) {
            return new ParsedResponse(null, error);
        }

        public boolean isSuccess() {
            return fields != null;
        }
    }
}
