package com.voicegateway.provider;

import com.voicegateway.exception.UpstreamException;
import com.voicegateway.model.AdapterDescriptor;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.reactor.bulkhead.operator.BulkheadOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Common plumbing for adapters that talk to a vendor over HTTP: client construction,
 * the optional per-adapter concurrency limit and error translation.
 */
@Slf4j
public abstract class AbstractHttpAdapter implements ProviderAdapter {

    public static final String BASE_URL = "base_url";
    public static final String MAX_CONCURRENT_CALLS = "max_concurrent_calls";

    // synthesized audio and base64 payloads exceed WebClient's 256 KB default
    private static final int MAX_IN_MEMORY_SIZE = 32 * 1024 * 1024;

    protected final AdapterDescriptor descriptor;
    protected final WebClient webClient;
    private final PayloadLimit payloadLimit;
    private final Bulkhead bulkhead;

    protected AbstractHttpAdapter(AdapterDescriptor descriptor, WebClient webClient, PayloadLimit payloadLimit) {
        this.descriptor = descriptor;
        this.webClient = webClient;
        this.payloadLimit = payloadLimit.withPolicyFrom(descriptor);
        this.bulkhead = createBulkhead(descriptor);
    }

    @Override
    public String getName() {
        return descriptor.getProviderName();
    }

    @Override
    public PayloadLimit getPayloadLimit() {
        return payloadLimit;
    }

    /**
     * Starts a client for the descriptor's {@code base_url} (or the vendor default) with JSON
     * content type and a raised in-memory buffer. Callers add their auth headers.
     */
    public static WebClient.Builder clientFor(WebClient.Builder webClientBuilder,
                                              AdapterDescriptor descriptor,
                                              String defaultBaseUrl) {
        return webClientBuilder.clone()
                .baseUrl(descriptor.parameter(BASE_URL, defaultBaseUrl))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE));
    }

    /**
     * Wraps one vendor call with the concurrency limit and maps every failure to an
     * {@link UpstreamException}.
     */
    protected <T> Mono<T> execute(String operation, Mono<T> call) {
        Mono<T> guarded = bulkhead != null ? call.transformDeferred(BulkheadOperator.of(bulkhead)) : call;
        return guarded
                .switchIfEmpty(Mono.error(() -> UpstreamErrors.malformed(getName(), "empty response body")))
                .onErrorMap(e -> UpstreamErrors.translate(getName(), e))
                .doOnError(UpstreamException.class, e -> log.warn("{} {} failed: kind={}, diagnostic={}",
                        getName(), operation, e.getKind().code(), e.getDiagnostic()));
    }

    protected String requireText(String value, String field) {
        if (value == null) {
            throw UpstreamErrors.malformed(getName(), "missing field " + field);
        }
        return value;
    }

    protected byte[] requireAudio(byte[] audio) {
        if (audio == null || audio.length == 0) {
            throw UpstreamErrors.malformed(getName(), "empty audio");
        }
        return audio;
    }

    private static Bulkhead createBulkhead(AdapterDescriptor descriptor) {
        int limit = descriptor.intParameter(MAX_CONCURRENT_CALLS, 0);
        if (limit <= 0) {
            return null;
        }
        BulkheadConfig config = BulkheadConfig.custom()
                .maxConcurrentCalls(limit)
                .maxWaitDuration(Duration.ZERO)
                .build();
        return Bulkhead.of(descriptor.getCapability().key() + "-" + descriptor.getProviderName(), config);
    }
}
