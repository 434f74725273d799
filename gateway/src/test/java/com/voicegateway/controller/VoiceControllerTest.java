package com.voicegateway.controller;

import com.voicegateway.config.GlobalExceptionHandler;
import com.voicegateway.exception.ErrorKind;
import com.voicegateway.model.VoiceModels;
import com.voicegateway.service.RateLimitService;
import com.voicegateway.service.SynthesisCacheService;
import com.voicegateway.testutil.GatewayFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.BodyInserters;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VoiceControllerTest {

    private GatewayFixture fixture;
    private SynthesisCacheService cacheService;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        fixture = new GatewayFixture();
        fixture.properties.getRateLimit().setRequestsPerMinute(3);
        cacheService = mock(SynthesisCacheService.class);
        when(cacheService.getCached(any())).thenReturn(Mono.empty());
        when(cacheService.cache(any(), any())).thenReturn(Mono.empty());
        RateLimitService rateLimitService = new RateLimitService(fixture.properties, fixture.meterRegistry);

        client = WebTestClient.bindToController(
                        new VoiceController(fixture.gatewayService, cacheService, rateLimitService))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void shouldGenerateReplyWithGatewayMetadata() {
        fixture.configureDefaults();

        client.post().uri("/api/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"user_input\":\"Hello\",\"context\":{\"robot\":\"kiosk\"},"
                        + "\"history\":[{\"role\":\"user\",\"content\":\"hi\"}]}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.response").isEqualTo("Hi from OpenAI")
                .jsonPath("$.gateway.provider").isEqualTo("openai")
                .jsonPath("$.gateway.attempts").isEqualTo(1)
                .jsonPath("$.gateway.truncated").isEqualTo(false);

        VoiceModels.GenerationRequest sent = fixture.openAiGeneration.lastRequest();
        assertThat(sent.getContext()).containsEntry("robot", "kiosk");
        assertThat(sent.getHistory()).extracting(VoiceModels.ConversationTurn::getContent).containsExactly("hi");
    }

    @Test
    void shouldReturnBadRequestForBlankInput() {
        fixture.configureDefaults();

        client.post().uri("/api/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"user_input\":\"  \"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.type").isEqualTo("invalid_request_error")
                .jsonPath("$.error.code").isEqualTo("request_validation_failed");
    }

    @Test
    void shouldReportMissingConfigurationWithField() {
        client.post().uri("/api/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"user_input\":\"Hello\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("config_validation_failed")
                .jsonPath("$.error.field").isEqualTo("generation.provider");
    }

    @Test
    void shouldMapUpstreamFailureToGatewayStatus() {
        fixture.configureDefaults();
        fixture.openAiGeneration.failAlwaysWith(ErrorKind.INVALID_CREDENTIALS);

        client.post().uri("/api/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"user_input\":\"Hello\"}")
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.error.type").isEqualTo("provider_error")
                .jsonPath("$.error.code").isEqualTo("invalid_credentials")
                .jsonPath("$.error.diagnostic").isEqualTo("scripted invalid_credentials");
    }

    @Test
    void shouldReturnRawAudioWithMetadataHeaders() {
        fixture.configureDefaults();

        byte[] audio = client.post().uri("/api/tts")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"text\":\"Good morning\",\"voice\":\"nova\"}")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentType("audio/wav")
                .expectHeader().valueEquals("X-Provider", "openai")
                .expectHeader().valueEquals("X-Cache", "MISS")
                .expectHeader().valueEquals("X-Truncated", "false")
                .expectHeader().exists("X-Request-Id")
                .expectBody(byte[].class)
                .returnResult()
                .getResponseBody();

        assertThat(new String(audio, StandardCharsets.UTF_8)).isEqualTo("Good morning");
        assertThat(fixture.openAiSynthesis.lastRequest().getVoiceHint()).isEqualTo("nova");
        verify(cacheService).cache(any(), any());
    }

    @Test
    void shouldServeCachedAudioWithoutCallingProvider() {
        fixture.configureDefaults();
        VoiceModels.SynthesisResult cached = VoiceModels.SynthesisResult.builder()
                .audio(new byte[]{9, 9})
                .mimeType("audio/mpeg")
                .gateway(VoiceModels.GatewayMetadata.builder().provider("openai").attempts(0).truncated(false).build())
                .build();
        when(cacheService.getCached(any())).thenReturn(Mono.just(cached));

        client.post().uri("/api/tts")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"text\":\"Good morning\"}")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentType("audio/mpeg")
                .expectHeader().valueEquals("X-Cache", "HIT")
                .expectBody(byte[].class).isEqualTo(new byte[]{9, 9});

        assertThat(fixture.openAiSynthesis.invocations()).isZero();
        verify(cacheService, never()).cache(any(), any());
    }

    @Test
    void shouldTranscribeUploadedAudioUsingFileExtension() {
        fixture.configureDefaults();
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("audio", new byte[]{1, 2, 3, 4}).filename("clip.webm");

        client.post().uri("/api/stt")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(body.build()))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.text").isEqualTo("hello from openai")
                .jsonPath("$.gateway.provider").isEqualTo("openai");

        VoiceModels.TranscriptionRequest sent = fixture.openAiTranscription.lastRequest();
        assertThat(sent.getAudio()).containsExactly(1, 2, 3, 4);
        assertThat(sent.getEncodingHint()).isEqualTo("webm");
    }

    @Test
    void shouldPreferExplicitEncodingPart() {
        fixture.configureDefaults();
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("audio", new byte[]{1, 2}).filename("recording.bin");
        body.part("encoding", "FLAC");

        client.post().uri("/api/stt")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(body.build()))
                .exchange()
                .expectStatus().isOk();

        assertThat(fixture.openAiTranscription.lastRequest().getEncodingHint()).isEqualTo("flac");
    }

    @Test
    void shouldRejectRequestsOverClientRateLimit() {
        fixture.configureDefaults();

        for (int i = 0; i < 3; i++) {
            client.post().uri("/api/generate")
                    .header("X-Client-Id", "robot-1")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"user_input\":\"Hello\"}")
                    .exchange()
                    .expectStatus().isOk();
        }

        client.post().uri("/api/generate")
                .header("X-Client-Id", "robot-1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"user_input\":\"Hello\"}")
                .exchange()
                .expectStatus().isEqualTo(429)
                .expectHeader().exists("Retry-After")
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("rate_limited");

        client.post().uri("/api/generate")
                .header("X-Client-Id", "robot-2")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"user_input\":\"Hello\"}")
                .exchange()
                .expectStatus().isOk();

        assertThat(fixture.openAiGeneration.invocations()).isEqualTo(4);
    }

    @Test
    void shouldRejectUnreadableBody() {
        fixture.configureDefaults();

        client.post().uri("/api/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"user_input\": ")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("request_validation_failed");

        assertThat(fixture.openAiGeneration.invocations()).isZero();
    }
}
