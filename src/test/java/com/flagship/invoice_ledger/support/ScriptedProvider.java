package com.flagship.invoice_ledger.support;

import com.flagship.invoice_ledger.provider.ImagePayload;
import com.flagship.invoice_ledger.provider.InferenceProvider;
import com.flagship.invoice_ledger.provider.TransientProviderException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Test provider whose answers come from a function of the submitted payloads.
 */
public class ScriptedProvider implements InferenceProvider {

    private final String id;
    private final BiFunction<List<ImagePayload>, String, String> behaviour;
    private final AtomicInteger calls = new AtomicInteger();

    public ScriptedProvider(String id, BiFunction<List<ImagePayload>, String, String> behaviour) {
        this.id = id;
        this.behaviour = behaviour;
    }

    public static ScriptedProvider answering(String id, String text) {
        return new ScriptedProvider(id, (payloads, instruction) -> text);
    }

    public static ScriptedProvider quotaExhausted(String id) {
        return new ScriptedProvider(id, (payloads, instruction) -> {
            throw TransientProviderException.quotaExceeded(id, "429 Too Many Requests");
        });
    }

    /**
     * Answers with one invoice per payload, numbered after the payload text.
     */
    public static ScriptedProvider echoingInvoiceNumbers(String id) {
        return new ScriptedProvider(id, (payloads, instruction) -> {
            if (payloads.size() == 1) {
                return invoiceJson(new String(payloads.get(0).getData(), StandardCharsets.UTF_8));
            }
            StringBuilder array = new StringBuilder("[");
            for (int i = 0; i < payloads.size(); i++) {
                if (i > 0) {
                    array.append(',');
                }
                array.append(invoiceJson(new String(payloads.get(i).getData(), StandardCharsets.UTF_8)));
            }
            return array.append(']').toString();
        });
    }

    public static String invoiceJson(String invoiceNumber) {
        return "{\"party_name\": \"Acme Traders\", \"party_gstin\": \"27ABCDE1234F1Z5\", "
            + "\"invoice_number\": \"" + invoiceNumber + "\", \"invoice_date\": \"15/01/2024\", "
            + "\"taxable_value\": 1000, \"cgst\": 90, \"sgst\": 90, \"igst\": null, \"invoice_value\": 1180}";
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String invoke(List<ImagePayload> payloads, String instruction, Duration timeout) {
        calls.incrementAndGet();
        return behaviour.apply(payloads, instruction);
    }

    public int calls() {
        return calls.get();
    }
}
