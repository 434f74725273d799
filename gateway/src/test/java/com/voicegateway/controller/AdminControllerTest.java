package com.voicegateway.controller;

import com.voicegateway.config.GlobalExceptionHandler;
import com.voicegateway.exception.ErrorKind;
import com.voicegateway.model.CapabilityKind;
import com.voicegateway.service.RateLimitService;
import com.voicegateway.service.SynthesisCacheService;
import com.voicegateway.testutil.GatewayFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AdminControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private GatewayFixture fixture;
    private SynthesisCacheService cacheService;
    private RateLimitService rateLimitService;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        fixture = new GatewayFixture();
        cacheService = mock(SynthesisCacheService.class);
        rateLimitService = new RateLimitService(fixture.properties, fixture.meterRegistry);
        AdminController controller = new AdminController(fixture.registry, fixture.statusReporter,
                cacheService, rateLimitService, Clock.fixed(NOW, ZoneOffset.UTC));
        client = WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void shouldReportLiveness() {
        client.get().uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("healthy")
                .jsonPath("$.service").isEqualTo("voice-gateway")
                .jsonPath("$.timestamp").isEqualTo("2024-05-01T10:00:00Z");
    }

    @Test
    void shouldReportUnconfiguredStatus() {
        client.get().uri("/api/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("unconfigured")
                .jsonPath("$.version").isEqualTo(0)
                .jsonPath("$.health.generation.state").isEqualTo("UNKNOWN");
    }

    @Test
    void shouldReportActiveProvidersAndHealth() {
        fixture.configureDefaults();
        fixture.switchProvider(CapabilityKind.GENERATION, "anthropic", "sk-ant-1");
        fixture.statusReporter.recordFailure(CapabilityKind.GENERATION, "anthropic", ErrorKind.QUOTA_EXCEEDED, NOW);

        client.get().uri("/api/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("running")
                .jsonPath("$.version").isEqualTo(2)
                .jsonPath("$.providers.transcription").isEqualTo("openai")
                .jsonPath("$.providers.generation").isEqualTo("anthropic")
                .jsonPath("$.health.generation.state").isEqualTo("FAILED")
                .jsonPath("$.health.generation.last_error_kind").isEqualTo("quota_exceeded")
                .jsonPath("$.health.synthesis.state").isEqualTo("UNKNOWN");
    }

    @Test
    void shouldClearSynthesisCache() {
        when(cacheService.invalidateCache("*")).thenReturn(Mono.just(3L));

        client.delete().uri("/admin/cache")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.cleared").isEqualTo(3);

        verify(cacheService).invalidateCache("*");
    }

    @Test
    void shouldInspectAndResetRateLimit() {
        fixture.properties.getRateLimit().setRequestsPerMinute(5);
        rateLimitService.tryConsume("robot-1");

        client.get().uri("/admin/ratelimit/robot-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.limit").isEqualTo(5)
                .jsonPath("$.remaining").isEqualTo(4);

        client.delete().uri("/admin/ratelimit/robot-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.identifier").isEqualTo("robot-1");

        client.get().uri("/admin/ratelimit/robot-1")
                .exchange()
                .expectBody()
                .jsonPath("$.remaining").isEqualTo(5);
    }
}
