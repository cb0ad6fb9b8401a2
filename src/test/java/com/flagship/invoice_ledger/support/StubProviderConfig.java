package com.flagship.invoice_ledger.support;

import com.flagship.invoice_ledger.provider.InferenceProvider;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

/**
 * Supplies the "stub-primary" provider named in the test application.yml.
 */
@TestConfiguration
public class StubProviderConfig {

    @Bean
    public InferenceProvider stubPrimary() {
        return ScriptedProvider.echoingInvoiceNumbers("stub-primary");
    }
}
