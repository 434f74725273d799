package com.voicegateway.provider.openai;

import com.voicegateway.model.AdapterDescriptor;
import com.voicegateway.model.CapabilityKind;
import com.voicegateway.provider.AdapterFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Set;

import static com.voicegateway.provider.AbstractHttpAdapter.clientFor;

/**
 * OpenAI serves all three capabilities, each registered as an independent adapter.
 */
@Configuration
public class OpenAiAdapters {

    public static final String PROVIDER_NAME = "openai";
    public static final String API_KEY = "api_key";
    static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    private static final Set<String> REQUIRED = Set.of(API_KEY);

    @Bean
    public AdapterFactory openAiTranscriptionFactory(WebClient.Builder webClientBuilder) {
        return AdapterFactory.of(CapabilityKind.TRANSCRIPTION, PROVIDER_NAME, REQUIRED,
                descriptor -> new OpenAiTranscriptionAdapter(client(webClientBuilder, descriptor), descriptor));
    }

    @Bean
    public AdapterFactory openAiSynthesisFactory(WebClient.Builder webClientBuilder) {
        return AdapterFactory.of(CapabilityKind.SYNTHESIS, PROVIDER_NAME, REQUIRED,
                descriptor -> new OpenAiSynthesisAdapter(client(webClientBuilder, descriptor), descriptor));
    }

    @Bean
    public AdapterFactory openAiGenerationFactory(WebClient.Builder webClientBuilder) {
        return AdapterFactory.of(CapabilityKind.GENERATION, PROVIDER_NAME, REQUIRED,
                descriptor -> new OpenAiGenerationAdapter(client(webClientBuilder, descriptor), descriptor));
    }

    static WebClient client(WebClient.Builder webClientBuilder, AdapterDescriptor descriptor) {
        return clientFor(webClientBuilder, descriptor, DEFAULT_BASE_URL)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + descriptor.credential(API_KEY))
                .build();
    }
}
