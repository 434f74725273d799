package com.voicegateway.controller;

import com.voicegateway.model.CapabilityHealth;
import com.voicegateway.model.CapabilityKind;
import com.voicegateway.model.ConfigModels;
import com.voicegateway.service.CapabilityRegistry;
import com.voicegateway.service.RateLimitService;
import com.voicegateway.service.StatusReporter;
import com.voicegateway.service.SynthesisCacheService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
public class AdminController {

    private final CapabilityRegistry registry;
    private final StatusReporter statusReporter;
    private final SynthesisCacheService cacheService;
    private final RateLimitService rateLimitService;
    private final Clock clock;

    /**
     * Liveness check endpoint
     */
    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.just(ResponseEntity.ok(Map.of(
                "status", "healthy",
                "timestamp", clock.instant().toString(),
                "service", "voice-gateway"
        )));
    }

    /**
     * Active providers and the last observed outcome per capability
     */
    @GetMapping("/api/status")
    public Mono<ConfigModels.StatusResponse> status() {
        return Mono.fromSupplier(() -> {
            Map<String, String> providers = new LinkedHashMap<>();
            Map<String, CapabilityHealth> health = new LinkedHashMap<>();
            for (CapabilityKind kind : CapabilityKind.values()) {
                providers.put(kind.key(), registry.activeProvider(kind).orElse(null));
            }
            statusReporter.report().forEach((kind, capabilityHealth) -> health.put(kind.key(), capabilityHealth));
            long version = registry.currentVersion();
            return ConfigModels.StatusResponse.builder()
                    .status(version > 0 ? "running" : "unconfigured")
                    .version(version)
                    .providers(providers)
                    .health(health)
                    .build();
        });
    }

    /**
     * Clear synthesis cache (admin)
     */
    @DeleteMapping("/admin/cache")
    public Mono<ResponseEntity<Map<String, Object>>> clearCache(
            @RequestParam(defaultValue = "*") String pattern) {
        return cacheService.invalidateCache(pattern)
                .map(count -> ResponseEntity.ok(Map.<String, Object>of(
                        "status", "success",
                        "cleared", count
                )));
    }

    /**
     * Reset rate limit for a client (admin)
     */
    @DeleteMapping("/admin/ratelimit/{identifier}")
    public ResponseEntity<Map<String, Object>> resetRateLimit(@PathVariable String identifier) {
        rateLimitService.resetLimit(identifier);
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "identifier", identifier
        ));
    }

    @GetMapping("/admin/ratelimit/{identifier}")
    public ResponseEntity<Map<String, Object>> getRateLimitInfo(@PathVariable String identifier) {
        RateLimitService.RateLimitInfo info = rateLimitService.getRateLimitInfo(identifier);
        return ResponseEntity.ok(Map.of(
                "identifier", identifier,
                "limit", info.limit(),
                "remaining", info.remaining(),
                "resetSeconds", info.resetSeconds()
        ));
    }
}
