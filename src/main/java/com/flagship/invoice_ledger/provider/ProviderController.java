package com.flagship.invoice_ledger.provider;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator view of the inference providers.
 */
@RestController
@RequestMapping(value = "/api/providers", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Slf4j
public class ProviderController {

    private final ProviderRegistry registry;

    @GetMapping
    public ResponseEntity<Map<String, Object>> listProviders() {
        return ResponseEntity.ok(describe(registry.snapshot()));
    }

    /**
     * Clears cooldowns, usage counters and failure streaks, for example after a key rotation.
     */
    @PostMapping("/reset")
    public ResponseEntity<Map<String, Object>> resetProviders() {
        log.info("Provider reset requested");
        registry.reset();
        Map<String, Object> body = describe(registry.snapshot());
        body.put("message", "All providers reset");
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> describe(List<ProviderState> states) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("providers", states);
        body.put("available", states.stream().filter(ProviderState::isAvailable).count());
        body.put("total", states.size());
        return body;
    }
}
