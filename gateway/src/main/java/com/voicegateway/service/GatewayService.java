package com.voicegateway.service;

import com.voicegateway.config.GatewayProperties;
import com.voicegateway.exception.ConfigValidationException;
import com.voicegateway.exception.GatewayException;
import com.voicegateway.exception.RequestValidationException;
import com.voicegateway.exception.UpstreamException;
import com.voicegateway.model.AdapterDescriptor;
import com.voicegateway.model.CapabilityKind;
import com.voicegateway.model.VoiceModels;
import com.voicegateway.provider.GenerationAdapter;
import com.voicegateway.provider.PayloadLimit;
import com.voicegateway.provider.ProviderAdapter;
import com.voicegateway.provider.SynthesisAdapter;
import com.voicegateway.provider.TranscriptionAdapter;
import com.voicegateway.provider.UpstreamErrors;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Single entry point for the three capabilities. Each request resolves its adapter once,
 * so a configuration change applied mid-request never switches providers under it. There
 * is no fallback to another provider: a failure of the active one reaches the caller as a
 * typed error after at most one retry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayService {

    private static final int MAX_ATTEMPTS = 2;
    private static final int PREVIEW_LENGTH = 40;

    private final CapabilityRegistry registry;
    private final StatusReporter statusReporter;
    private final RequestValidator validator;
    private final GatewayProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public Mono<VoiceModels.TranscriptionResult> transcribe(VoiceModels.TranscriptionRequest request) {
        CapabilityKind kind = CapabilityKind.TRANSCRIPTION;
        return Mono.defer(() -> {
            VoiceModels.TranscriptionRequest validated = validator.validate(request);
            CapabilityRegistry.Binding<TranscriptionAdapter> binding = registry.bind(kind, TranscriptionAdapter.class);
            TranscriptionAdapter adapter = binding.adapter();
            checkAudio(adapter, validated.getAudio());
            log.debug("Transcribing {} bytes of {} via {}", validated.getAudio().length,
                    validated.getEncodingHint(), adapter.getName());

            return invoke(kind, adapter, () -> adapter.transcribe(validated))
                    .map(outcome -> outcome.result().toBuilder()
                            .gateway(outcome.metadata(false, binding.descriptor()))
                            .build());
        }).doOnError(e -> recordRejectedBeforeCall(kind, e));
    }

    public Mono<VoiceModels.SynthesisResult> synthesize(VoiceModels.SynthesisRequest request) {
        CapabilityKind kind = CapabilityKind.SYNTHESIS;
        return Mono.defer(() -> {
            VoiceModels.SynthesisRequest validated = validator.validate(request);
            CapabilityRegistry.Binding<SynthesisAdapter> binding = registry.bind(kind, SynthesisAdapter.class);
            SynthesisAdapter adapter = binding.adapter();
            FittedText text = fitText(adapter, validated.getText());
            VoiceModels.SynthesisRequest outbound = validated.toBuilder().text(text.value()).build();
            log.debug("Synthesizing '{}' via {}", preview(outbound.getText()), adapter.getName());

            return invoke(kind, adapter, () -> adapter.synthesize(outbound))
                    .map(outcome -> outcome.result().toBuilder()
                            .gateway(outcome.metadata(text.truncated(), binding.descriptor()))
                            .build());
        }).doOnError(e -> recordRejectedBeforeCall(kind, e));
    }

    public Mono<VoiceModels.GenerationResult> generate(VoiceModels.GenerationRequest request) {
        CapabilityKind kind = CapabilityKind.GENERATION;
        return Mono.defer(() -> {
            VoiceModels.GenerationRequest validated = validator.validate(request);
            CapabilityRegistry.Binding<GenerationAdapter> binding = registry.bind(kind, GenerationAdapter.class);
            GenerationAdapter adapter = binding.adapter();
            FittedText input = fitText(adapter, validated.getUserInput());
            VoiceModels.GenerationRequest outbound = validated.toBuilder().userInput(input.value()).build();
            log.debug("Generating reply to '{}' via {} ({} context entries, {} history turns)",
                    preview(outbound.getUserInput()), adapter.getName(),
                    outbound.getContext().size(), outbound.getHistory().size());

            return invoke(kind, adapter, () -> adapter.generate(outbound))
                    .map(outcome -> outcome.result().toBuilder()
                            .gateway(outcome.metadata(input.truncated(), binding.descriptor()))
                            .build());
        }).doOnError(e -> recordRejectedBeforeCall(kind, e));
    }

    /**
     * Calls the adapter under the capability timeout, retrying once on transient failures.
     * Health is recorded before the outcome is emitted.
     */
    private <R> Mono<Outcome<R>> invoke(CapabilityKind kind, ProviderAdapter adapter, Supplier<Mono<R>> call) {
        String provider = adapter.getName();
        String requestId = UUID.randomUUID().toString();
        AtomicInteger attempts = new AtomicInteger();
        Timer.Sample sample = Timer.start(meterRegistry);

        return Mono.defer(() -> {
                    attempts.incrementAndGet();
                    return call.get();
                })
                .timeout(properties.getRouting().timeoutFor(kind))
                .onErrorMap(e -> !(e instanceof GatewayException), e -> UpstreamErrors.translate(provider, e))
                .retryWhen(Retry.backoff(MAX_ATTEMPTS - 1, properties.getRouting().getRetryBackoff())
                        .filter(GatewayService::isRetryable)
                        .doBeforeRetry(signal -> {
                            log.warn("Retrying {} {} after {}", kind.key(), provider,
                                    ((UpstreamException) signal.failure()).getKind().code());
                            meterRegistry.counter("voice.gateway.retries",
                                    "capability", kind.key(), "provider", provider).increment();
                        })
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .map(result -> {
                    long latencyMs = TimeUnit.NANOSECONDS.toMillis(sample.stop(meterRegistry.timer(
                            "voice.gateway.latency", "capability", kind.key(), "provider", provider)));
                    statusReporter.recordSuccess(kind, provider, clock.instant());
                    meterRegistry.counter("voice.gateway.requests",
                            "capability", kind.key(), "provider", provider, "status", "success").increment();
                    log.info("{} via {} completed in {}ms after {} attempt(s)",
                            kind.key(), provider, latencyMs, attempts.get());
                    return new Outcome<>(result, provider, requestId, latencyMs, attempts.get());
                })
                .doOnError(GatewayException.class, e -> {
                    statusReporter.recordFailure(kind, provider, e.getKind(), clock.instant());
                    meterRegistry.counter("voice.gateway.requests",
                            "capability", kind.key(), "provider", provider, "status", e.getKind().code()).increment();
                    log.error("{} via {} failed after {} attempt(s): {}",
                            kind.key(), provider, attempts.get(), e.getMessage());
                });
    }

    private static boolean isRetryable(Throwable error) {
        return error instanceof UpstreamException && ((UpstreamException) error).getKind().isRetryable();
    }

    // failures raised before the adapter was invoked; upstream outcomes are recorded in invoke
    private void recordRejectedBeforeCall(CapabilityKind kind, Throwable error) {
        if (error instanceof RequestValidationException || error instanceof ConfigValidationException) {
            GatewayException failure = (GatewayException) error;
            String provider = registry.activeProvider(kind).orElse(null);
            statusReporter.recordFailure(kind, provider, failure.getKind(), clock.instant());
            meterRegistry.counter("voice.gateway.requests", "capability", kind.key(),
                    "provider", provider == null ? "none" : provider, "status", failure.getKind().code()).increment();
            log.warn("{} request rejected: {}", kind.key(), failure.getMessage());
        }
    }

    private void checkAudio(ProviderAdapter adapter, byte[] audio) {
        PayloadLimit limit = adapter.getPayloadLimit();
        if (limit.exceededBy(audio.length)) {
            throw new RequestValidationException("audio is " + audio.length + " bytes, provider "
                    + adapter.getName() + " accepts at most " + limit.max());
        }
    }

    private FittedText fitText(ProviderAdapter adapter, String text) {
        PayloadLimit limit = adapter.getPayloadLimit();
        long size = limit.sizeOf(text);
        if (!limit.exceededBy(size)) {
            return new FittedText(text, false);
        }
        if (limit.truncate()) {
            log.info("Truncating input for {} from {} to {} characters", adapter.getName(), size, limit.max());
            int end = (int) limit.max();
            if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
                end--;
            }
            return new FittedText(text.substring(0, end), true);
        }
        throw new RequestValidationException("input is " + size + " " + limit.unit().name().toLowerCase()
                + ", provider " + adapter.getName() + " accepts at most " + limit.max());
    }

    private static String preview(String text) {
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH) + "...";
    }

    private record FittedText(String value, boolean truncated) {
    }

    private record Outcome<R>(R result, String provider, String requestId, long latencyMs, int attempts) {

        VoiceModels.GatewayMetadata metadata(boolean truncated, AdapterDescriptor descriptor) {
            return VoiceModels.GatewayMetadata.builder()
                    .provider(provider)
                    .requestId(requestId)
                    .latencyMs(latencyMs)
                    .attempts(attempts)
                    .truncated(truncated)
                    .settingsKey(descriptor.settingsKey())
                    .build();
        }
    }
}
