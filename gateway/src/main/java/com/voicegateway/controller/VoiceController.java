package com.voicegateway.controller;

import com.voicegateway.exception.RateLimitExceededException;
import com.voicegateway.model.VoiceModels;
import com.voicegateway.service.GatewayService;
import com.voicegateway.service.RateLimitService;
import com.voicegateway.service.SynthesisCacheService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.http.codec.multipart.FormFieldPart;
import org.springframework.http.codec.multipart.Part;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Voice pipeline endpoints used by the robot client.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class VoiceController {

    static final String CLIENT_ID_HEADER = "X-Client-Id";

    private final GatewayService gatewayService;
    private final SynthesisCacheService cacheService;
    private final RateLimitService rateLimitService;

    /**
     * Speech to text. The encoding comes from the {@code encoding} part when given, otherwise
     * from the uploaded file's extension.
     */
    @PostMapping(value = "/stt", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<VoiceModels.TranscriptionResult> speechToText(
            @RequestPart("audio") FilePart audio,
            @RequestPart(value = "encoding", required = false) Part encoding,
            @RequestHeader(value = CLIENT_ID_HEADER, required = false) String clientId) {

        checkRateLimit(clientId);
        String encodingHint = encoding instanceof FormFieldPart field ? field.value() : extensionOf(audio.filename());

        return DataBufferUtils.join(audio.content())
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .defaultIfEmpty(new byte[0])
                .flatMap(bytes -> {
                    log.info("STT request received: file={}, bytes={}, encoding={}", audio.filename(), bytes.length, encodingHint);
                    return gatewayService.transcribe(VoiceModels.TranscriptionRequest.builder()
                            .audio(bytes)
                            .encodingHint(encodingHint)
                            .build());
                });
    }

    /**
     * Text to speech. Returns the raw audio with the provider's MIME type.
     */
    @PostMapping("/tts")
    public Mono<ResponseEntity<byte[]>> textToSpeech(
            @RequestBody VoiceModels.SynthesisRequest request,
            @RequestHeader(value = CLIENT_ID_HEADER, required = false) String clientId) {

        checkRateLimit(clientId);
        log.info("TTS request received: chars={}, voice={}",
                request.getText() != null ? request.getText().length() : 0, request.getVoiceHint());

        return cacheService.getCached(request)
                .map(result -> toAudioResponse(result, true))
                .switchIfEmpty(Mono.defer(() ->
                        gatewayService.synthesize(request)
                                .flatMap(result -> cacheService.cache(request, result).thenReturn(result))
                                .map(result -> toAudioResponse(result, false))));
    }

    @PostMapping("/generate")
    public Mono<VoiceModels.GenerationResult> generate(
            @RequestBody VoiceModels.GenerationRequest request,
            @RequestHeader(value = CLIENT_ID_HEADER, required = false) String clientId) {

        checkRateLimit(clientId);
        log.info("Generate request received: chars={}, context={}, history={}",
                request.getUserInput() != null ? request.getUserInput().length() : 0,
                request.getContext() != null ? request.getContext().size() : 0,
                request.getHistory() != null ? request.getHistory().size() : 0);

        return gatewayService.generate(request);
    }

    private void checkRateLimit(String clientId) {
        long retryAfter = rateLimitService.tryConsume(clientId);
        if (retryAfter > 0) {
            throw new RateLimitExceededException(clientId == null ? "anonymous" : clientId, retryAfter);
        }
    }

    private static ResponseEntity<byte[]> toAudioResponse(VoiceModels.SynthesisResult result, boolean cached) {
        VoiceModels.GatewayMetadata gateway = result.getGateway();
        ResponseEntity.BodyBuilder builder = ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(result.getMimeType()))
                .header("X-Cache", cached ? "HIT" : "MISS");
        if (gateway != null) {
            builder.header("X-Provider", gateway.getProvider())
                    .header("X-Truncated", String.valueOf(Boolean.TRUE.equals(gateway.getTruncated())));
            if (gateway.getRequestId() != null) {
                builder.header("X-Request-Id", gateway.getRequestId());
            }
            if (gateway.getLatencyMs() != null) {
                builder.header("X-Latency-Ms", String.valueOf(gateway.getLatencyMs()));
            }
        }
        return builder.body(result.getAudio());
    }

    private static String extensionOf(String filename) {
        if (filename == null) {
            return null;
        }
        int dot = filename.lastIndexOf('.');
        return dot >= 0 && dot < filename.length() - 1 ? filename.substring(dot + 1) : null;
    }
}
