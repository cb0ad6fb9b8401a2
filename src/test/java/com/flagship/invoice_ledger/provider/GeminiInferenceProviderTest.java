package com.flagship.invoice_ledger.provider;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GeminiInferenceProviderTest {

    private static final String URL =
            "https://example.test/v1beta/models/gemini-2.5-flash:generateContent?key=secret";

    private MockRestServiceServer server;
    private GeminiInferenceProvider provider;
    private final List<ImagePayload> payloads = List.of(
            new ImagePayload("invoice".getBytes(StandardCharsets.UTF_8), "image/png"));

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        provider = new GeminiInferenceProvider("gemini-2.5-flash", "gemini-2.5-flash", "secret",
                builder, "https://example.test");
    }

    @Test
    @DisplayName("Should send inline images followed by the instruction and return candidate text")
    void returnsCandidateText() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.contents[0].parts[0].inline_data.mime_type").value("image/png"))
                .andExpect(jsonPath("$.contents[0].parts[1].text").value("extract"))
                .andRespond(withSuccess("""
                        {"candidates": [{"content": {"parts": [{"text": "{\\"invoice_number\\": "}, {"text": "\\"7\\"}"}]}}]}
                        """, MediaType.APPLICATION_JSON));

        String text = provider.invoke(payloads, "extract", Duration.ofSeconds(5));

        assertEquals("{\"invoice_number\": \"7\"}", text);
        server.verify();
    }

    @Test
    @DisplayName("HTTP 429 should be reported as quota exhaustion")
    void tooManyRequestsIsQuota() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        TransientProviderException ex = assertThrows(TransientProviderException.class,
                () -> provider.invoke(payloads, "extract", Duration.ofSeconds(5)));
        assertTrue(ex.isQuotaExceeded());
        assertEquals("gemini-2.5-flash", ex.getProviderId());
    }

    @Test
    @DisplayName("A RESOURCE_EXHAUSTED body should be reported as quota exhaustion")
    void resourceExhaustedBodyIsQuota() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.FORBIDDEN)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\": {\"status\": \"RESOURCE_EXHAUSTED\"}}"));

        TransientProviderException ex = assertThrows(TransientProviderException.class,
                () -> provider.invoke(payloads, "extract", Duration.ofSeconds(5)));
        assertTrue(ex.isQuotaExceeded());
    }

    @Test
    @DisplayName("Server errors should be transient without quota")
    void serverErrorIsTransient() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        TransientProviderException ex = assertThrows(TransientProviderException.class,
                () -> provider.invoke(payloads, "extract", Duration.ofSeconds(5)));
        assertFalse(ex.isQuotaExceeded());
    }

    @Test
    @DisplayName("Should refuse to build without an API key")
    void requiresApiKey() {
        assertThrows(IllegalArgumentException.class, () -> new GeminiInferenceProvider(
                "gemini", "gemini-2.5-flash", " ", RestClient.builder(), "https://example.test"));
    }
}
