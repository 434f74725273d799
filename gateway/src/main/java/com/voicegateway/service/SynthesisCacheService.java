package com.voicegateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voicegateway.config.GatewayProperties;
import com.voicegateway.model.AdapterDescriptor;
import com.voicegateway.model.CapabilityKind;
import com.voicegateway.model.VoiceModels;
import com.voicegateway.provider.PayloadLimit;
import com.voicegateway.provider.SynthesisAdapter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;

/**
 * Redis cache of synthesized audio. Entries are keyed by the serving provider, its endpoint
 * parameters, the voice and the text, so a provider switch or a parameter change never
 * serves stale audio. Redis being unavailable behaves like a miss.
 *
 * <p>A hit is served without calling the provider and is not recorded in the capability
 * health. Lookups only happen for text the active adapter would accept unchanged; anything
 * else misses so the gateway applies its validation and oversize policy.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SynthesisCacheService {

    private static final String CACHE_PREFIX = "voice:tts:";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final CapabilityRegistry registry;
    private final GatewayProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * Audio previously synthesized by the active provider, or empty
     */
    public Mono<VoiceModels.SynthesisResult> getCached(VoiceModels.SynthesisRequest request) {
        if (!properties.getCache().isEnabled() || request == null
                || request.getText() == null || request.getText().isBlank()) {
            return Mono.empty();
        }
        if (registry.activeProvider(CapabilityKind.SYNTHESIS).isEmpty()) {
            return Mono.empty();
        }
        CapabilityRegistry.Binding<SynthesisAdapter> active = registry.bind(CapabilityKind.SYNTHESIS, SynthesisAdapter.class);
        PayloadLimit limit = active.adapter().getPayloadLimit();
        if (limit.exceededBy(limit.sizeOf(request.getText()))) {
            return Mono.empty();
        }

        AdapterDescriptor descriptor = active.descriptor();
        String cacheKey = generateCacheKey(descriptor.settingsKey(), request);
        return redisTemplate.opsForValue().get(cacheKey)
                .flatMap(cached -> {
                    try {
                        CachedAudio audio = objectMapper.readValue(cached, CachedAudio.class);
                        meterRegistry.counter("voice.cache", "status", "hit").increment();
                        log.debug("Cache hit for key: {}", cacheKey);
                        return Mono.just(VoiceModels.SynthesisResult.builder()
                                .audio(audio.audio())
                                .mimeType(audio.mimeType())
                                .gateway(VoiceModels.GatewayMetadata.builder()
                                        .provider(descriptor.getProviderName())
                                        .attempts(0)
                                        .latencyMs(0L)
                                        .truncated(false)
                                        .build())
                                .build());
                    } catch (JsonProcessingException e) {
                        log.error("Failed to deserialize cached audio for key {}", cacheKey, e);
                        return Mono.empty();
                    }
                })
                .switchIfEmpty(Mono.defer(() -> {
                    meterRegistry.counter("voice.cache", "status", "miss").increment();
                    return Mono.empty();
                }))
                .onErrorResume(e -> {
                    log.warn("Synthesis cache lookup failed, treating as miss: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    /**
     * Stores a result under the settings of the adapter that produced it, even if the
     * configuration changed while the request was in flight. Truncated results are not
     * cached because their audio does not match the requested text.
     */
    public Mono<Void> cache(VoiceModels.SynthesisRequest request, VoiceModels.SynthesisResult result) {
        VoiceModels.GatewayMetadata gateway = result.getGateway();
        if (!properties.getCache().isEnabled() || gateway == null || gateway.getSettingsKey() == null
                || Boolean.TRUE.equals(gateway.getTruncated())) {
            return Mono.empty();
        }

        String cacheKey = generateCacheKey(gateway.getSettingsKey(), request);
        try {
            String serialized = objectMapper.writeValueAsString(new CachedAudio(result.getMimeType(), result.getAudio()));
            Duration ttl = Duration.ofSeconds(properties.getCache().getTtlSeconds());

            return redisTemplate.opsForValue().set(cacheKey, serialized, ttl)
                    .doOnSuccess(success -> log.debug("Cached audio for key: {}", cacheKey))
                    .onErrorResume(e -> {
                        log.warn("Failed to cache synthesized audio: {}", e.getMessage());
                        return Mono.empty();
                    })
                    .then();
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize audio for caching", e);
            return Mono.empty();
        }
    }

    public Mono<Long> invalidateCache(String pattern) {
        return redisTemplate.keys(CACHE_PREFIX + pattern)
                .flatMap(redisTemplate::delete)
                .reduce(0L, Long::sum);
    }

    String generateCacheKey(String settingsKey, VoiceModels.SynthesisRequest request) {
        try {
            StringBuilder sb = new StringBuilder();
            sb.append(settingsKey).append('|');
            sb.append(request.getVoiceHint() != null ? request.getVoiceHint().trim() : "default");
            sb.append('|');
            sb.append(request.getText());

            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(sb.toString().getBytes(StandardCharsets.UTF_8));
            return CACHE_PREFIX + HexFormat.of().formatHex(hash).substring(0, 32);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public record CachedAudio(String mimeType, byte[] audio) {
    }
}
