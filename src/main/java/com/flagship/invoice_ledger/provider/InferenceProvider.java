package com.flagship.invoice_ledger.provider;

import java.time.Duration;
import java.util.List;

/**
 * Uniform view of an external AI inference capability: submit image payloads
 * with an instruction, receive free-form text.
 */
public interface InferenceProvider {

    /**
     * Stable identifier used for selection, quota accounting and reporting.
     */
    String getId();

    /**
     * Runs one inference call.
     *
     * @param payloads documents to submit, in order
     * @param instruction prompt text sent along with the payloads
     * @param timeout upper bound the provider should honour for the remote call
     * @return raw text returned by the model
     * @throws TransientProviderException on timeout, transport failure, 5xx or quota exhaustion
     */
    String invoke(List<ImagePayload> payloads, String instruction, Duration timeout);
}
