package com.flagship.invoice_ledger.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Google Gemini {@code generateContent} client.
 *
 * Images are sent inline (base64) followed by the instruction text; the returned
 * candidate text is passed back untouched for the extraction layer to parse.
 */
@Slf4j
public class GeminiInferenceProvider implements InferenceProvider {

    private final String id;
    private final String model;
    private final String apiKey;
    private final RestClient restClient;

    public GeminiInferenceProvider(String id, String model, String apiKey,
                                   RestClient.Builder builder, String baseUrl) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("API key is required for provider " + id);
        }
        this.id = id;
        this.model = model;
        this.apiKey = apiKey;
        this.restClient = builder.baseUrl(baseUrl).build();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String invoke(List<ImagePayload> payloads, String instruction, Duration timeout) {
        List<Map<String, Object>> parts = new ArrayList<>();
        for (ImagePayload payload : payloads) {
            parts.add(Map.of("inline_data", Map.of(
                "mime_type", payload.getMimeType(),
                "data", Base64.getEncoder().encodeToString(payload.getData())
            )));
        }
        parts.add(Map.of("text", instruction));

        Map<String, Object> body = Map.of(
            "contents", List.of(Map.of("parts", parts)),
            "generationConfig", Map.of("temperature", 0)
        );

        try {
            GenerateContentResponse response = restClient.post()
                .uri("/v1beta/models/{model}:generateContent?key={key}", model, apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(GenerateContentResponse.class);

            String text = extractText(response);
            log.debug("Gemini call succeeded: provider={}, images={}, chars={}", id, payloads.size(), text.length());
            return text;

        } catch (RestClientResponseException e) {
            throw classify(e);
        } catch (ResourceAccessException e) {
            throw new TransientProviderException(id, "I/O error calling " + model + ": " + e.getMessage(), false, e);
        } catch (RestClientException e) {
            throw new TransientProviderException(id, "Call to " + model + " failed: " + e.getMessage(), false, e);
        }
    }

    private TransientProviderException classify(RestClientResponseException e) {
        HttpStatusCode status = e.getStatusCode();
        String responseBody = e.getResponseBodyAsString();
        if (status.value() == 429 || responseBody.contains("RESOURCE_EXHAUSTED")) {
            return new TransientProviderException(id, "Quota exceeded for " + model, true, e);
        }
        if (status.is5xxServerError()) {
            return new TransientProviderException(id, "Server error " + status.value() + " from " + model, false, e);
        }
        return new TransientProviderException(id, "Request rejected with " + status.value() + " by " + model, false, e);
    }

    private static String extractText(GenerateContentResponse response) {
        if (response == null || response.candidates() == null || response.candidates().isEmpty()) {
            return "";
        }
        Content content = response.candidates().get(0).content();
        if (content == null || content.parts() == null) {
            return "";
        }
        return content.parts().stream()
            .map(Part::text)
            .filter(text -> text != null)
            .collect(Collectors.joining());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Part(String text) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Content(List<Part> parts) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Candidate(Content content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateContentResponse(List<Candidate> candidates) {}
}
